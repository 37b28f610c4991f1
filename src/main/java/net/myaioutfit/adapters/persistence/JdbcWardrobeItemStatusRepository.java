package net.myaioutfit.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.myaioutfit.domain.wardrobe.ProcessingStatus;
import net.myaioutfit.domain.wardrobe.StatusUpdate;
import net.myaioutfit.domain.wardrobe.WardrobeItemStatus;
import net.myaioutfit.domain.wardrobe.WardrobeItemStatusRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * JDBC adapter over the item store's {@code wardrobe_items} table.
 *
 * <p>Only the processing columns are touched. Every statement filters on both {@code id} and
 * {@code user_id}, so a mismatched owner reads nothing and updates zero rows.</p>
 */
@Repository
@Slf4j
public class JdbcWardrobeItemStatusRepository implements WardrobeItemStatusRepository {

    // user_id is compared as text so UUID and varchar owner columns both work
    private static final String OWNER_PREDICATE = "id = ? AND CAST(user_id AS VARCHAR) = ?";

    private static final String STATUS_COLUMNS =
        "id, user_id, bg_removal_status, bg_removal_started_at, bg_removal_completed_at, image_url";

    private static final String SELECT_STATUS =
        "SELECT " + STATUS_COLUMNS + " FROM wardrobe_items WHERE " + OWNER_PREDICATE;

    private static final RowMapper<WardrobeItemStatus> STATUS_ROW_MAPPER = JdbcWardrobeItemStatusRepository::mapStatus;

    private final JdbcTemplate jdbcTemplate;

    public JdbcWardrobeItemStatusRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean existsForOwner(UUID itemId, String ownerId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM wardrobe_items WHERE " + OWNER_PREDICATE,
            Integer.class,
            itemId,
            ownerId);
        return count != null && count > 0;
    }

    @Override
    public Optional<WardrobeItemStatus> findStatus(UUID itemId, String ownerId) {
        List<WardrobeItemStatus> rows = jdbcTemplate.query(SELECT_STATUS, STATUS_ROW_MAPPER, itemId, ownerId);
        return rows.stream().findFirst();
    }

    @Override
    public int updateStatus(UUID itemId, String ownerId, StatusUpdate update) {
        StringBuilder sql = new StringBuilder("UPDATE wardrobe_items SET bg_removal_status = ?");
        List<Object> args = new ArrayList<>();
        args.add(update.status().dbValue());
        if (update.startedAt() != null) {
            sql.append(", bg_removal_started_at = ?");
            args.add(Timestamp.from(update.startedAt()));
        }
        if (update.completedAt() != null) {
            sql.append(", bg_removal_completed_at = ?");
            args.add(Timestamp.from(update.completedAt()));
        } else if (update.clearCompletedAt()) {
            sql.append(", bg_removal_completed_at = NULL");
        }
        if (update.imageUrl() != null) {
            sql.append(", image_url = ?");
            args.add(update.imageUrl());
        }
        sql.append(" WHERE ").append(OWNER_PREDICATE);
        args.add(itemId);
        args.add(ownerId);

        int rows = jdbcTemplate.update(sql.toString(), args.toArray());
        if (rows == 0) {
            log.debug("Status update to {} matched no row for item {} and owner {}",
                update.status().dbValue(), itemId, ownerId);
        }
        return rows;
    }

    @Override
    public List<WardrobeItemStatus> findStaleProcessing(Instant startedBefore, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return jdbcTemplate.query("SELECT " + STATUS_COLUMNS + """
                 FROM wardrobe_items
                WHERE bg_removal_status = ?
                  AND bg_removal_started_at < ?
                ORDER BY bg_removal_started_at
                LIMIT ?
                """,
            STATUS_ROW_MAPPER,
            ProcessingStatus.PROCESSING.dbValue(),
            Timestamp.from(startedBefore),
            limit);
    }

    @Override
    public boolean failIfStillProcessing(UUID itemId, String ownerId, Instant startedBefore, Instant completedAt) {
        int rows = jdbcTemplate.update(
            "UPDATE wardrobe_items SET bg_removal_status = ?, bg_removal_completed_at = ?"
                + " WHERE " + OWNER_PREDICATE
                + " AND bg_removal_status = ? AND bg_removal_started_at < ?",
            ProcessingStatus.FAILED.dbValue(),
            Timestamp.from(completedAt),
            itemId,
            ownerId,
            ProcessingStatus.PROCESSING.dbValue(),
            Timestamp.from(startedBefore));
        return rows > 0;
    }

    private static WardrobeItemStatus mapStatus(ResultSet rs, int rowNum) throws SQLException {
        return new WardrobeItemStatus(
            rs.getObject("id", UUID.class),
            rs.getString("user_id"),
            ProcessingStatus.fromDbValue(rs.getString("bg_removal_status")).orElse(null),
            toInstant(rs.getTimestamp("bg_removal_started_at")),
            toInstant(rs.getTimestamp("bg_removal_completed_at")),
            rs.getString("image_url"));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
