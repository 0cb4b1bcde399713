package uz.greenwhite.deviceauth.flow;

/**
 * Raised when authenticate() or refresh() is called while another attempt is still running.
 */
public class AttemptInProgressException extends IllegalStateException {

    public AttemptInProgressException() {
        super("A device authorization attempt is already in progress");
    }
}
