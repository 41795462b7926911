package com.tinyurl.repository;

import com.tinyurl.model.ShortLink;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcShortLinkRepository implements ShortLinkRepository {

    private static final String TABLE = "short_links";
    private static final String COLUMNS = "id, short_code, long_url, click_count, created_at, updated_at";

    private static final RowMapper<ShortLink> ROW_MAPPER = (rs, rowNum) -> new ShortLink(
            rs.getLong("id"),
            rs.getString("short_code"),
            rs.getString("long_url"),
            rs.getLong("click_count"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant());

    private final JdbcTemplate jdbcTemplate;
    private final SimpleJdbcInsert insert;

    public JdbcShortLinkRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.insert = new SimpleJdbcInsert(jdbcTemplate)
                .withTableName(TABLE)
                .usingColumns("short_code", "long_url", "click_count", "created_at", "updated_at")
                .usingGeneratedKeyColumns("id");
    }

    @Override
    public ShortLink create(ShortLink link) {
        Number id = insert.executeAndReturnKey(Map.of(
                "short_code", link.shortCode(),
                "long_url", link.longUrl(),
                "click_count", link.clickCount(),
                "created_at", Timestamp.from(link.createdAt()),
                "updated_at", Timestamp.from(link.updatedAt())));
        return link.withId(id.longValue());
    }

    @Override
    public Optional<ShortLink> findByShortCode(String shortCode) {
        return queryForOptional("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE short_code = ?", shortCode);
    }

    @Override
    public Optional<ShortLink> findByLongUrl(String longUrl) {
        return queryForOptional("SELECT " + COLUMNS + " FROM " + TABLE
                + " WHERE long_url = ? ORDER BY created_at DESC, id DESC LIMIT 1", longUrl);
    }

    @Override
    public ShortLink update(ShortLink link) {
        int rows = jdbcTemplate.update(
                "UPDATE " + TABLE + " SET long_url = ?, click_count = ?, updated_at = ? WHERE short_code = ?",
                link.longUrl(), link.clickCount(), Timestamp.from(link.updatedAt()), link.shortCode());
        if (rows == 0) {
            throw new EmptyResultDataAccessException("No short link with code " + link.shortCode(), 1);
        }
        return findByShortCode(link.shortCode()).orElse(link);
    }

    @Override
    public boolean deleteByShortCode(String shortCode) {
        return jdbcTemplate.update("DELETE FROM " + TABLE + " WHERE short_code = ?", shortCode) > 0;
    }

    @Override
    public Optional<ShortLink> getStats(String shortCode) {
        return findByShortCode(shortCode);
    }

    @Override
    public boolean exists(String shortCode) {
        List<Integer> found = jdbcTemplate.queryForList(
                "SELECT 1 FROM " + TABLE + " WHERE short_code = ? LIMIT 1", Integer.class, shortCode);
        return !found.isEmpty();
    }

    private Optional<ShortLink> queryForOptional(String sql, Object arg) {
        return jdbcTemplate.query(sql, ROW_MAPPER, arg).stream().findFirst();
    }
}
