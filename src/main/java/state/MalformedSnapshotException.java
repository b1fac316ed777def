package state;

/** Snapshot payload is missing a required key or is not an object at all. */
public class MalformedSnapshotException extends RuntimeException {

    public MalformedSnapshotException(String message) {
        super(message);
    }
}
