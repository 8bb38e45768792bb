package com.authplatform.authsvc.infra.persistence;

import com.authplatform.authsvc.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, String> {

    Optional<User> findByEmail(String email);

    @Query("SELECT u FROM User u WHERE u.resetToken = :token AND u.resetTokenExpiry > :now")
    Optional<User> findByLiveResetToken(@Param("token") String token, @Param("now") Instant now);

    @Query("SELECT u FROM User u WHERE u.verificationToken = :token AND u.verificationTokenExpiry > :now")
    Optional<User> findByLiveVerificationToken(@Param("token") String token, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE User u SET u.resetToken = NULL, u.resetTokenExpiry = NULL, u.updatedAt = :now
            WHERE u.id = :id AND u.resetToken = :token""")
    int clearResetToken(@Param("id") String id, @Param("token") String token, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE User u SET u.verificationToken = NULL, u.verificationTokenExpiry = NULL,
                u.emailVerified = :verifiedAt, u.updatedAt = :now
            WHERE u.id = :id AND u.verificationToken = :token""")
    int clearVerificationToken(@Param("id") String id, @Param("token") String token,
                               @Param("verifiedAt") Instant verifiedAt, @Param("now") Instant now);
}
