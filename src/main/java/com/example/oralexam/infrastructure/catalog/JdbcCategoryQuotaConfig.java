package com.example.oralexam.infrastructure.catalog;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class JdbcCategoryQuotaConfig implements CategoryQuotaConfig {

    private final JdbcTemplate jdbcTemplate;

    public JdbcCategoryQuotaConfig(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Map<Long, Integer> quotas() {
        Map<Long, Integer> out = new LinkedHashMap<>();
        jdbcTemplate.query("SELECT id, quota FROM categories ORDER BY id",
                rs -> {
                    out.put(rs.getLong("id"), rs.getInt("quota"));
                });
        return out;
    }
}
