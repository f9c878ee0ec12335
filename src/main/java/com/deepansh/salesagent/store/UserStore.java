package com.deepansh.salesagent.store;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class UserStore {

    private final JdbcTemplate jdbcTemplate;

    public Optional<UserProfile> findProfile(String userId) {
        return jdbcTemplate.query(
                "SELECT user_id, name, loyalty_tier FROM users WHERE user_id = ?",
                (rs, i) -> new UserProfile(rs.getString("user_id"), rs.getString("name"),
                        rs.getString("loyalty_tier")),
                userId).stream().findFirst();
    }

    public boolean exists(String userId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM users WHERE user_id = ?", Integer.class, userId);
        return count != null && count > 0;
    }

    /** @return rows updated; 0 when the user does not exist */
    public int updateName(String userId, String name) {
        return jdbcTemplate.update("UPDATE users SET name = ? WHERE user_id = ?", name, userId);
    }
}
