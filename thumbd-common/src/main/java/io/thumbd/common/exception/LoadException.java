package io.thumbd.common.exception;

public sealed class LoadException extends RuntimeException
    permits LoadException.Network,
            LoadException.Http,
            LoadException.Decode {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class Network extends LoadException {
        public Network(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class Http extends LoadException {
        private final int statusCode;

        public Http(int statusCode) {
            super("HTTP error: " + statusCode);
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }
    }

    public static final class Decode extends LoadException {
        public Decode(String message) {
            super(message);
        }

        public Decode(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
