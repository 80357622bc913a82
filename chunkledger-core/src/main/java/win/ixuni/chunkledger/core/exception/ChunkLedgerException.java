package win.ixuni.chunkledger.core.exception;

import lombok.Getter;

/**
 * ChunkLedger base exception
 * <p>
 * Carries a stable error code and the HTTP status a transport layer would map it to.
 */
@Getter
public class ChunkLedgerException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public ChunkLedgerException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public ChunkLedgerException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
