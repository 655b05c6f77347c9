package fun.fengwk.brickhub.core.service.color;

import fun.fengwk.brickhub.core.service.catalog.CatalogPageClient;
import fun.fengwk.brickhub.core.service.catalog.CatalogProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColorGuideService {

    public static final String DEFAULT_LOCALE = "en-us";

    private static final Pattern LOCALE_PATTERN = Pattern.compile("[a-z]{2}(-[a-z]{2})?");

    private final CatalogProperties catalogProperties;
    private final CatalogPageClient catalogPageClient;
    private final ColorGuideParser colorGuideParser;

    public List<ColorGuideEntry> fetchColorGuide(String locale) throws IOException {
        String normalizedLocale = StringUtils.isBlank(locale) ? DEFAULT_LOCALE : locale.trim().toLowerCase(Locale.ROOT);
        if (!LOCALE_PATTERN.matcher(normalizedLocale).matches()) {
            throw new IllegalArgumentException("unsupported locale: " + locale);
        }
        String url = catalogProperties.getColorGuideUrl().replace("{locale}", normalizedLocale);
        List<ColorGuideEntry> entries = colorGuideParser.parse(catalogPageClient.fetchHtml(url), url);
        log.info("color guide fetched, locale={}, entries={}", normalizedLocale, entries.size());
        return entries;
    }

}
