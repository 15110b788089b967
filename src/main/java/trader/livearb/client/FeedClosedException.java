package trader.livearb.client;

import lombok.Getter;

/**
 * The remote side ended the session with something other than a normal close.
 */
@Getter
public class FeedClosedException extends RuntimeException {

    private final int closeCode;

    public FeedClosedException(int closeCode, String reason) {
        super("Feed session closed abnormally: code=" + closeCode + (reason == null ? "" : ", reason=" + reason));
        this.closeCode = closeCode;
    }
}
