package com.authplatform.authsvc.infra.persistence;

import com.authplatform.authsvc.domain.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findByProviderAndProviderAccountId(String provider, String providerAccountId);

    Optional<Account> findFirstByUserIdAndProvider(String userId, String provider);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Account a WHERE a.userId = :userId")
    int deleteAllByUserId(@Param("userId") String userId);
}
