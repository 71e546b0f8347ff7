package uk.gegc.learnhub.shared.persistence;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Recognises unique-key violations raised by the create-or-fetch inserts.
 */
public final class UniqueConstraints {

    public static final String LESSON_PROGRESS_USER_LESSON = "uq_lesson_progress_user_lesson";
    public static final String ENROLLMENT_USER_COURSE = "uq_enrollment_user_course";

    private static final String SQL_STATE_UNIQUE_VIOLATION = "23505";
    private static final int MYSQL_DUPLICATE_ENTRY = 1062;

    private UniqueConstraints() {
    }

    /**
     * True when {@code e} was caused by a violation of {@code constraintName}. When the
     * driver does not report a constraint name, any unique-key violation matches.
     */
    public static boolean isViolationOf(DataIntegrityViolationException e, String constraintName) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                return violation.getConstraintName().toLowerCase(Locale.ROOT)
                        .contains(constraintName.toLowerCase(Locale.ROOT));
            }
            if (cause instanceof SQLException sql && isUniqueViolation(sql)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static boolean isUniqueViolation(SQLException e) {
        return SQL_STATE_UNIQUE_VIOLATION.equals(e.getSQLState()) || e.getErrorCode() == MYSQL_DUPLICATE_ENTRY;
    }
}
