package uz.greenwhite.delegation.app;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import uz.greenwhite.delegation.error.DelegationException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static uz.greenwhite.delegation.util.SqlTimestamps.toInstant;
import static uz.greenwhite.delegation.util.SqlTimestamps.toOffset;

@Repository
@RequiredArgsConstructor
public class AppRepository {

    private static final String COLUMNS =
            "id, service, password, callback_url, expiry, created_at, status";

    private static final String SELECT_BY_ID_SQL =
            "SELECT " + COLUMNS + " FROM auth.apps WHERE id = :id";

    private static final String SELECT_BY_SERVICE_SQL =
            """
            SELECT %s
            FROM auth.apps
            WHERE service = :service AND status = :status
            ORDER BY created_at DESC
            LIMIT 1
            """.formatted(COLUMNS);

    private static final String INSERT_SQL =
            """
            INSERT INTO auth.apps
              (id, service, password, callback_url, expiry, created_at, status)
            VALUES
              (:id, :service, :password, :callbackUrl, :expiry, :createdAt, :status)
            """;

    private static final String UPDATE_STATUS_SQL =
            "UPDATE auth.apps SET status = :status WHERE id = :id RETURNING " + COLUMNS;

    private static final RowMapper<App> ROW_MAPPER = AppRepository::mapRow;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public Optional<App> findById(String id) {
        List<App> apps = jdbcTemplate.query(SELECT_BY_ID_SQL, new MapSqlParameterSource("id", id), ROW_MAPPER);
        return apps.stream().findFirst();
    }

    /**
     * Newest enabled App serving {@code service}
     */
    public Optional<App> findEnabledByService(String service) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("service", service)
                .addValue("status", AppStatus.ENABLE.getValue());
        return jdbcTemplate.query(SELECT_BY_SERVICE_SQL, params, ROW_MAPPER).stream().findFirst();
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException when the id is taken
     */
    public void insert(App app) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", app.getId())
                .addValue("service", app.getService())
                .addValue("password", app.getPassword())
                .addValue("callbackUrl", app.getCallbackUrl())
                .addValue("expiry", toOffset(app.getExpiry()))
                .addValue("createdAt", toOffset(app.getCreatedAt()))
                .addValue("status", app.getStatus().getValue());
        jdbcTemplate.update(INSERT_SQL, params);
    }

    public Optional<App> updateStatus(String id, AppStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("status", status.getValue());
        return jdbcTemplate.query(UPDATE_STATUS_SQL, params, ROW_MAPPER).stream().findFirst();
    }

    private static App mapRow(ResultSet rs, int rowNum) throws SQLException {
        return App.builder()
                .id(rs.getString("id"))
                .service(rs.getString("service"))
                .password(rs.getString("password"))
                .callbackUrl(rs.getString("callback_url"))
                .expiry(toInstant(rs.getObject("expiry", OffsetDateTime.class)))
                .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
                .status(statusOf(rs.getString("status")))
                .build();
    }

    static AppStatus statusOf(String value) {
        return AppStatus.fromValue(value)
                .orElseThrow(() -> DelegationException.internal("unrecognized app status in storage: " + value, null));
    }
}
