package output;

import java.io.IOException;

public interface Notifier {
    void send(String text) throws IOException;
}
