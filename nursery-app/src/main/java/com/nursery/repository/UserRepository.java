package com.nursery.repository;

import com.nursery.model.AppUser;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

@Repository
public class UserRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<AppUser> USER_MAPPER = (rs, rowNum) -> new AppUser(
        rs.getString("username"),
        rs.getString("password_hash"),
        rs.getObject("created_at", OffsetDateTime.class).toInstant()
    );

    public UserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<AppUser> findByUsername(String username) {
        var results = jdbc.query(
            "SELECT username, password_hash, created_at FROM app_user WHERE username = ?",
            USER_MAPPER, username
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public boolean exists(String username) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM app_user WHERE username = ?",
            Integer.class, username
        );
        return count != null && count > 0;
    }

    /**
     * Inserts a new user. A concurrent insert of the same username surfaces as
     * {@link org.springframework.dao.DuplicateKeyException}.
     */
    public void save(AppUser user) {
        jdbc.update(
            "INSERT INTO app_user (username, password_hash, created_at) VALUES (?, ?, ?)",
            user.username(), user.passwordHash(), user.createdAt().atOffset(ZoneOffset.UTC)
        );
    }
}
