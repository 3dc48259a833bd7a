package ru.tigran.chatanalytics.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.tigran.chatanalytics.exception.ConfigurationException;
import ru.tigran.chatanalytics.exception.ErrorCode;
import ru.tigran.chatanalytics.model.ProductContext;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves a product context to the physical table that holds its interaction log.
 *
 * Table names end up in the SQL text (identifiers cannot be bound), so each configured name
 * is checked against a plain identifier pattern when the resolver is built.
 */
@Slf4j
@Component
public class DatasetResolver {

    private static final Pattern IDENTIFIER =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final Map<ProductContext, String> tables;
    private final String internalUsersTable;

    public DatasetResolver(
            @Value("${app.datasets.pool-table:interaction_log}") String poolTable,
            @Value("${app.datasets.landscape-table:landscape_interaction_log}") String landscapeTable,
            @Value("${app.datasets.internal-users-table:internal_users}") String internalUsersTable
    ) {
        Map<ProductContext, String> configured = new EnumMap<>(ProductContext.class);
        putIfPresent(configured, ProductContext.POOL, poolTable);
        putIfPresent(configured, ProductContext.LANDSCAPE, landscapeTable);
        this.tables = Collections.unmodifiableMap(configured);
        this.internalUsersTable = requireIdentifier("internal users", internalUsersTable);
        log.info("Datasets configured: {}, internal users table: {}", tables, this.internalUsersTable);
    }

    /**
     * @param context product context
     * @return physical table name
     * @throws ConfigurationException if no table is configured for the context
     */
    public String tableFor(ProductContext context) {
        String table = context == null ? null : tables.get(context);
        if (table == null) {
            throw new ConfigurationException(
                    "No dataset configured for product context: " + context,
                    ErrorCode.DATASET_NOT_CONFIGURED.getCode()
            );
        }
        return table;
    }

    public String internalUsersTable() {
        return internalUsersTable;
    }

    private static void putIfPresent(Map<ProductContext, String> target, ProductContext context, String table) {
        if (table != null && !table.isBlank()) {
            target.put(context, requireIdentifier(context.getValue(), table));
        }
    }

    private static String requireIdentifier(String label, String name) {
        String trimmed = name == null ? "" : name.trim();
        if (!IDENTIFIER.matcher(trimmed).matches()) {
            throw new ConfigurationException(
                    "Dataset name for " + label + " is not a valid SQL identifier: '" + name + "'",
                    ErrorCode.INVALID_DATASET_NAME.getCode()
            );
        }
        return trimmed;
    }
}
