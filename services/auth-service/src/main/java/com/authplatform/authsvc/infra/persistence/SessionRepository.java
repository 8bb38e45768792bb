package com.authplatform.authsvc.infra.persistence;

import com.authplatform.authsvc.domain.model.Session;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface SessionRepository extends JpaRepository<Session, String> {

    @Query("SELECT s FROM Session s WHERE s.refreshToken = :token AND s.refreshTokenExpires > :now")
    Optional<Session> findByLiveRefreshToken(@Param("token") String token, @Param("now") Instant now);

    /**
     * Swaps the refresh token only while it still holds {@code current}. Returns the number of
     * rows changed, so 0 means another caller got there first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Session s SET s.refreshToken = :next, s.refreshTokenExpires = :refreshExpires,
                s.expires = :sessionExpires
            WHERE s.sessionToken = :sessionToken AND s.refreshToken = :current""")
    int swapRefreshToken(@Param("sessionToken") String sessionToken,
                         @Param("current") String current,
                         @Param("next") String next,
                         @Param("refreshExpires") Instant refreshExpires,
                         @Param("sessionExpires") Instant sessionExpires);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Session s WHERE s.sessionToken = :sessionToken")
    int deleteOne(@Param("sessionToken") String sessionToken);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Session s WHERE s.userId = :userId")
    int deleteAllByUserId(@Param("userId") String userId);
}
