package output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import log.EngineLog;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;

/** Bot API sendMessage. */
public class TelegramNotifier implements Notifier {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl sendUrl;
    private final String chatId;

    public TelegramNotifier(OkHttpClient http, String apiUrl, String token, String chatId) {
        this.http = http;
        this.chatId = chatId;
        this.sendUrl = HttpUrl.get(apiUrl).newBuilder()
                .addPathSegment("bot" + token)
                .addPathSegment("sendMessage")
                .build();
    }

    @Override
    public void send(String text) throws IOException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("chat_id", chatId);
        payload.put("text", text);

        Request req = new Request.Builder()
                .url(sendUrl)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .build();

        try (Response res = http.newCall(req).execute()) {
            if (!res.isSuccessful()) {
                throw new IOException("Telegram HTTP " + res.code());
            }
        }
        EngineLog.log("NOTIFY", null, "sent: " + text);
    }
}
