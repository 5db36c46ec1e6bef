package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;

/**
 * Profile stats are changed with in-place increments only, never read-modify-write.
 */
public interface UserProfileRepository extends JpaRepository<UserProfile, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserProfile u SET u.totalBookingsAsDriver = u.totalBookingsAsDriver + 1 WHERE u.id = :userId")
    int incrementDriverBookingCount(@Param("userId") String userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserProfile u SET u.totalEarnings = u.totalEarnings + :amount WHERE u.id = :userId")
    int addHostEarnings(@Param("userId") String userId, @Param("amount") BigDecimal amount);
}
