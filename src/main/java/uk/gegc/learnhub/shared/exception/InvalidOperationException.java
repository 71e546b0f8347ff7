package uk.gegc.learnhub.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a caller asks for an update that does not fit the target's
 * current shape or state, e.g. grading a quiz attempt against a video lesson
 * or dropping an enrollment that is already completed.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidOperationException extends RuntimeException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
