package uz.greenwhite.delegation.token;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

import static uz.greenwhite.delegation.util.SqlTimestamps.toInstant;
import static uz.greenwhite.delegation.util.SqlTimestamps.toOffset;

@Repository
@RequiredArgsConstructor
public class TokenRepository {

    private static final String SELECT_SQL =
            """
            SELECT user_id, service, token_type, access_token, refresh_token, expiry, created_at
            FROM auth.tokens
            WHERE user_id = :userId AND service = :service
            """;

    // Every material column is replaced so a stored token never mixes two grants.
    private static final String UPSERT_SQL =
            """
            INSERT INTO auth.tokens
              (user_id, service, token_type, access_token, refresh_token, expiry, created_at)
            VALUES
              (:userId, :service, :tokenType, :accessToken, :refreshToken, :expiry, :createdAt)
            ON CONFLICT (user_id, service) DO UPDATE
            SET token_type = excluded.token_type,
                access_token = excluded.access_token,
                refresh_token = excluded.refresh_token,
                expiry = excluded.expiry,
                created_at = excluded.created_at
            """;

    private static final String UPDATE_SQL =
            """
            UPDATE auth.tokens
            SET token_type = :tokenType,
                access_token = :accessToken,
                refresh_token = :refreshToken,
                expiry = :expiry,
                created_at = :createdAt
            WHERE user_id = :userId AND service = :service
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public Optional<Token> find(long userId, String service) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("service", service);

        return jdbcTemplate.query(
                        SELECT_SQL,
                        params,
                        (rs, rowNum) -> Token.builder()
                                .userId(rs.getLong("user_id"))
                                .service(rs.getString("service"))
                                .tokenType(rs.getString("token_type"))
                                .accessToken(rs.getString("access_token"))
                                .refreshToken(rs.getString("refresh_token"))
                                .expiry(toInstant(rs.getObject("expiry", OffsetDateTime.class)))
                                .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
                                .build())
                .stream()
                .findFirst();
    }

    public void upsert(Token token) {
        jdbcTemplate.update(UPSERT_SQL, toParams(token));
    }

    /**
     * @return number of rows updated, 0 when the token no longer exists
     */
    public int update(Token token) {
        return jdbcTemplate.update(UPDATE_SQL, toParams(token));
    }

    private static MapSqlParameterSource toParams(Token token) {
        return new MapSqlParameterSource()
                .addValue("userId", token.getUserId())
                .addValue("service", token.getService())
                .addValue("tokenType", token.getTokenType())
                .addValue("accessToken", token.getAccessToken())
                .addValue("refreshToken", token.getRefreshToken())
                .addValue("expiry", toOffset(token.getExpiry()))
                .addValue("createdAt", toOffset(token.getCreatedAt()));
    }
}
