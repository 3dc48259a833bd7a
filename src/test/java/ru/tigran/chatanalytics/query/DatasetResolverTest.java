package ru.tigran.chatanalytics.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.chatanalytics.exception.ConfigurationException;
import ru.tigran.chatanalytics.exception.ErrorCode;
import ru.tigran.chatanalytics.model.ProductContext;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DatasetResolver unit тесты")
class DatasetResolverTest {

    @Test
    @DisplayName("Каждый product_context разрешается в свою таблицу")
    void resolvesConfiguredTables() {
        DatasetResolver resolver = new DatasetResolver("interaction_log", "analytics.landscape_log", "internal_users");

        assertEquals("interaction_log", resolver.tableFor(ProductContext.POOL));
        assertEquals("analytics.landscape_log", resolver.tableFor(ProductContext.LANDSCAPE));
        assertEquals("internal_users", resolver.internalUsersTable());
    }

    @Test
    @DisplayName("Контекст без таблицы -> DATASET_NOT_CONFIGURED")
    void failsForUnmappedContext() {
        DatasetResolver resolver = new DatasetResolver("interaction_log", "", "internal_users");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> resolver.tableFor(ProductContext.LANDSCAPE));
        assertEquals(ErrorCode.DATASET_NOT_CONFIGURED.getCode(), e.getErrorCode());
    }

    @Test
    @DisplayName("Имя таблицы с SQL -> INVALID_DATASET_NAME при создании")
    void rejectsNonIdentifier() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new DatasetResolver("interaction_log; DROP TABLE x", "landscape_log", "internal_users"));

        assertEquals(ErrorCode.INVALID_DATASET_NAME.getCode(), e.getErrorCode());
    }
}
