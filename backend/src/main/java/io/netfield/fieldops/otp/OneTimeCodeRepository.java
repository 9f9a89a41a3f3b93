package io.netfield.fieldops.otp;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OneTimeCodeRepository extends JpaRepository<OneTimeCode, UUID> {

  /** The live code for a subject and purpose, row-locked for verification. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      """
      SELECT c FROM OneTimeCode c
      WHERE c.subjectAddress = :subject
        AND c.purpose = :purpose
        AND c.supersededAt IS NULL
      """)
  Optional<OneTimeCode> findCurrentForUpdate(
      @Param("subject") String subjectAddress, @Param("purpose") CodePurpose purpose);

  /** Retires every live code for the pair so that a newly issued one is the only valid code. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE OneTimeCode c SET c.supersededAt = :now
      WHERE c.subjectAddress = :subject
        AND c.purpose = :purpose
        AND c.supersededAt IS NULL
      """)
  int supersedeCurrent(
      @Param("subject") String subjectAddress,
      @Param("purpose") CodePurpose purpose,
      @Param("now") Instant now);

  long countBySubjectAddressAndPurposeAndCreatedAtAfter(
      String subjectAddress, CodePurpose purpose, Instant after);

  /**
   * Deletes superseded codes that expired before {@code cutoff}. The live code of a pair is kept
   * however old it is, so a late verify still reports it as expired or consumed.
   */
  @Modifying
  @Query(
      """
      DELETE FROM OneTimeCode c
      WHERE c.supersededAt IS NOT NULL
        AND c.expiresAt < :cutoff
      """)
  int deleteSupersededExpiredBefore(@Param("cutoff") Instant cutoff);
}
