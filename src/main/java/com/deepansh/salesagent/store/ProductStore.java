package com.deepansh.salesagent.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the product catalog and inventory tables.
 *
 * All queries are parameterized through JdbcTemplate; category and name
 * comparisons are case-insensitive. Results are ordered so callers see the
 * same rows in the same order for the same inputs.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ProductStore {

    private static final RowMapper<Product> PRODUCT_MAPPER = (rs, i) -> new Product(
            rs.getString("product_id"),
            rs.getString("name"),
            rs.getString("category"),
            rs.getDouble("base_price"));

    private static final RowMapper<InventoryRecord> INVENTORY_MAPPER = (rs, i) -> new InventoryRecord(
            rs.getString("sku"),
            rs.getString("product_id"),
            rs.getString("size"),
            rs.getInt("quantity"),
            rs.getString("location"),
            rs.getString("name"),
            rs.getString("category"));

    private static final String INVENTORY_SELECT = """
            SELECT i.sku, i.product_id, i.size, i.quantity, i.location, p.name, p.category
            FROM inventory i
            LEFT JOIN products p ON i.product_id = p.product_id
            """;

    private final JdbcTemplate jdbcTemplate;

    // ─── Products ─────────────────────────────────────────────────────────────

    /**
     * @param exact    true: category equals (case-insensitive); false: category contains the term
     * @param minPrice inclusive lower bound, or null
     * @param maxPrice inclusive upper bound, or null
     */
    public List<Product> findByCategory(String category, boolean exact,
                                        Double minPrice, Double maxPrice, int limit) {
        StringBuilder sql = new StringBuilder(
                "SELECT product_id, name, category, base_price FROM products WHERE ");
        List<Object> args = new ArrayList<>();

        if (exact) {
            sql.append("LOWER(category) = LOWER(?)");
            args.add(category);
        } else {
            sql.append("LOWER(category) LIKE LOWER(?)");
            args.add("%" + category + "%");
        }
        if (minPrice != null) {
            sql.append(" AND base_price >= ?");
            args.add(minPrice);
        }
        if (maxPrice != null) {
            sql.append(" AND base_price <= ?");
            args.add(maxPrice);
        }
        sql.append(" ORDER BY base_price ASC, product_id ASC LIMIT ?");
        args.add(limit);

        List<Product> rows = jdbcTemplate.query(sql.toString(), PRODUCT_MAPPER, args.toArray());
        log.debug("Product lookup [category={}, exact={}, min={}, max={}] → {} rows",
                category, exact, minPrice, maxPrice, rows.size());
        return rows;
    }

    public Optional<String> findIdByExactName(String name) {
        return jdbcTemplate.queryForList(
                "SELECT product_id FROM products WHERE LOWER(name) = LOWER(?) ORDER BY product_id LIMIT 1",
                String.class, name.strip()).stream().findFirst();
    }

    public Optional<String> findIdByNameLike(String name) {
        return jdbcTemplate.queryForList(
                "SELECT product_id FROM products WHERE LOWER(name) LIKE LOWER(?) ORDER BY product_id LIMIT 1",
                String.class, "%" + name.strip() + "%").stream().findFirst();
    }

    // ─── Inventory ────────────────────────────────────────────────────────────

    public Optional<InventoryRecord> findInventory(String sku, String size) {
        return jdbcTemplate.query(INVENTORY_SELECT + "WHERE i.sku = ? AND UPPER(i.size) = UPPER(?)",
                INVENTORY_MAPPER, sku, size).stream().findFirst();
    }

    public List<InventoryRecord> findInventoryBySku(String sku) {
        return jdbcTemplate.query(INVENTORY_SELECT + "WHERE i.sku = ? ORDER BY i.size",
                INVENTORY_MAPPER, sku);
    }

    public List<InventoryRecord> findInventoryByProduct(String productId) {
        return jdbcTemplate.query(INVENTORY_SELECT + "WHERE i.product_id = ? ORDER BY i.sku, i.size",
                INVENTORY_MAPPER, productId);
    }
}
