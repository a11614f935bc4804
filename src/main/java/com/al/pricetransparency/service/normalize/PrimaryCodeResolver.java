package com.al.pricetransparency.service.normalize;

import com.al.pricetransparency.config.IngestionProperties;
import com.al.pricetransparency.model.enums.CodeType;
import com.al.pricetransparency.model.mrf.CodeInformation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the code an item is primarily looked up by.
 *
 * <p>
 * The first code whose type appears earliest in {@code app.ingestion.primary-code-types}
 * wins; when none of the preferred types is present the item's first code is used.
 * The result depends only on the item's codes and the configured order.
 */
@Component
@Slf4j
public class PrimaryCodeResolver {

    private final List<CodeType> priority;

    public PrimaryCodeResolver(IngestionProperties properties) {
        this.priority = new ArrayList<>();
        for (String value : properties.getPrimaryCodeTypes()) {
            CodeType type = CodeType.fromValue(value);
            if (type == null) {
                log.warn("Ignoring unknown primary code type '{}'", value);
                continue;
            }
            priority.add(type);
        }
    }

    public CodeInformation resolve(List<CodeInformation> codes) {
        if (codes == null || codes.isEmpty()) {
            return null;
        }
        for (CodeType preferred : priority) {
            for (CodeInformation code : codes) {
                if (code != null && code.getType() == preferred) {
                    return code;
                }
            }
        }
        return codes.get(0);
    }

    public List<CodeType> getPriority() {
        return List.copyOf(priority);
    }
}
