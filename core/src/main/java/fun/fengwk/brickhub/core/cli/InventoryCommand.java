package fun.fengwk.brickhub.core.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.brickhub.core.service.inventory.InventoryService;
import fun.fengwk.brickhub.core.service.inventory.model.Inventory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * One-shot command, {@code --inventory=<setNumber>} prints the enriched inventory as JSON and exits.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryCommand implements ApplicationRunner {

    static final String OPTION = "inventory";

    private final InventoryService inventoryService;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION)) {
            return;
        }
        System.exit(execute(args.getOptionValues(OPTION), System.out));
    }

    int execute(List<String> setNumbers, PrintStream out) {
        if (setNumbers == null || setNumbers.isEmpty()) {
            log.warn("missing set number, usage: --{}=<setNumber>", OPTION);
            return 2;
        }
        try {
            for (String setNumber : setNumbers) {
                Inventory inventory = inventoryService.fetchInventory(setNumber);
                out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(inventory));
            }
            out.flush();
            return 0;
        } catch (Exception ex) {
            log.warn("inventory command failed, setNumbers={}, error={}", setNumbers, ex.getMessage(), ex);
            return 1;
        }
    }

}
