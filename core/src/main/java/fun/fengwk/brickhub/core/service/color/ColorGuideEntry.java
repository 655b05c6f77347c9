package fun.fengwk.brickhub.core.service.color;

/**
 * One row of the BrickLink color guide.
 *
 * @param legoColorName null when the row has no LEGO mapping
 * @param legoColorId null when the LEGO mapping carries no numeric id
 * @param hexColor {@code #RRGGBB}, null when the swatch has no color
 * @author fengwk
 */
public record ColorGuideEntry(
    int brickLinkColorId,
    String brickLinkName,
    String legoColorName,
    Integer legoColorId,
    String hexColor
) {
}
