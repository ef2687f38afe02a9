package uz.greenwhite.delegation.exchange;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Optional;

import static uz.greenwhite.delegation.util.SqlTimestamps.toInstant;
import static uz.greenwhite.delegation.util.SqlTimestamps.toOffset;

@Repository
@RequiredArgsConstructor
public class ExchangeRepository {

    private static final String SELECT_SQL =
            "SELECT id, service, user_id, created_at FROM auth.exchanges WHERE id = :id";

    private static final String INSERT_SQL =
            """
            INSERT INTO auth.exchanges (id, service, user_id, created_at)
            VALUES (:id, :service, :userId, :createdAt)
            """;

    private static final String DELETE_SQL =
            "DELETE FROM auth.exchanges WHERE id = :id";

    private static final String DELETE_EXPIRED_SQL =
            "DELETE FROM auth.exchanges WHERE created_at < :cutoff";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public Optional<Exchange> findById(String id) {
        return jdbcTemplate.query(
                        SELECT_SQL,
                        new MapSqlParameterSource("id", id),
                        (rs, rowNum) -> Exchange.builder()
                                .id(rs.getString("id"))
                                .service(rs.getString("service"))
                                .userId(rs.getLong("user_id"))
                                .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
                                .build())
                .stream()
                .findFirst();
    }

    public void insert(Exchange exchange) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", exchange.getId())
                .addValue("service", exchange.getService())
                .addValue("userId", exchange.getUserId())
                .addValue("createdAt", toOffset(exchange.getCreatedAt()));
        jdbcTemplate.update(INSERT_SQL, params);
    }

    /**
     * @return number of rows removed, 0 when the exchange was already gone
     */
    public int deleteById(String id) {
        return jdbcTemplate.update(DELETE_SQL, new MapSqlParameterSource("id", id));
    }

    public int deleteCreatedBefore(Instant cutoff) {
        return jdbcTemplate.update(DELETE_EXPIRED_SQL, new MapSqlParameterSource("cutoff", toOffset(cutoff)));
    }
}
