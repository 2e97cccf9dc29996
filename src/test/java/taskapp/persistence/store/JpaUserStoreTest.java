package taskapp.persistence.store;

import java.sql.SQLException;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for how {@link JpaUserStore} tells a duplicate email apart from other integrity failures.
 */
class JpaUserStoreTest {

    @Test
    void recognizesEmailConstraintByExtractedName() {
        final DataIntegrityViolationException failure = new DataIntegrityViolationException(
                "could not execute statement",
                new ConstraintViolationException("insert failed", new SQLException("duplicate"), "UK_USERS_EMAIL"));

        assertThat(JpaUserStore.violatesEmailConstraint(failure)).isTrue();
    }

    @Test
    void recognizesEmailConstraintInDriverMessage() {
        final DataIntegrityViolationException failure = new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("Unique index or primary key violation: \"PUBLIC.UK_USERS_EMAIL_INDEX_4 ON "
                        + "PUBLIC.USERS(EMAIL NULLS FIRST) VALUES ( /* 1 */ 'alice@example.com' )\""));

        assertThat(JpaUserStore.violatesEmailConstraint(failure)).isTrue();
    }

    @Test
    void otherIntegrityFailuresAreNotDuplicates() {
        final DataIntegrityViolationException tooLong = new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("Value too long for column \"NAME CHARACTER VARYING(255)\""));
        final DataIntegrityViolationException primaryKey = new DataIntegrityViolationException(
                "could not execute statement",
                new ConstraintViolationException("insert failed", new SQLException("duplicate"), "users_pkey"));

        assertThat(JpaUserStore.violatesEmailConstraint(tooLong)).isFalse();
        assertThat(JpaUserStore.violatesEmailConstraint(primaryKey)).isFalse();
    }
}
