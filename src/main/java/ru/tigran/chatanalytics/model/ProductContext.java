package ru.tigran.chatanalytics.model;

/**
 * Product context selecting which of the two parallel interaction logs a KPI reads.
 * The physical table behind each context is resolved by {@code DatasetResolver}.
 */
public enum ProductContext {
    POOL("pool"),
    LANDSCAPE("landscape");

    private final String value;

    ProductContext(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Get ProductContext enum by its wire token (case-insensitive)
     * @param value the string value ("pool", "landscape")
     * @return ProductContext enum or throws IllegalArgumentException if not found
     */
    public static ProductContext fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("product_context cannot be null or empty");
        }
        for (ProductContext context : ProductContext.values()) {
            if (context.value.equalsIgnoreCase(value.trim())) {
                return context;
            }
        }
        throw new IllegalArgumentException("Invalid product_context: " + value);
    }
}
