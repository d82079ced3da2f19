package ai.sturdy.patcher.repair;

/**
 * Runtime exception used to propagate repair assistant failures.
 */
public class PatchRepairException extends RuntimeException {

    public PatchRepairException(String message) {
        super(message);
    }

    public PatchRepairException(String message, Throwable cause) {
        super(message, cause);
    }
}
