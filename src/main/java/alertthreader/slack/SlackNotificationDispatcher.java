package alertthreader.slack;

import alertthreader.threader.DispatchException;
import alertthreader.threader.NotificationDispatcher;
import alertthreader.threader.message.ChatMessage;
import alertthreader.utils.HttpUtils;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通过 Slack chat.postMessage 发送告警
 */
@Slf4j
public class SlackNotificationDispatcher implements NotificationDispatcher {

    private final String apiUrl;
    private final String channel;
    private final Map<String, String> headers;

    public SlackNotificationDispatcher(String apiUrl, String botToken, String channel) {
        this.apiUrl = apiUrl;
        this.channel = channel;
        this.headers = new HashMap<>();
        headers.put("Authorization", "Bearer " + botToken);
    }

    @Override
    public String post(ChatMessage message, String threadId) throws DispatchException {
        String payload = JSON.toJSONString(buildPayload(message, threadId));

        SlackPostMessageResponse response;
        try {
            response = HttpUtils.post(apiUrl, headers, payload, SlackPostMessageResponse.class);
        } catch (IOException | JSONException e) {
            throw new DispatchException("Slack request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new DispatchException("Slack returned an empty response");
        }
        if (!response.isOk()) {
            throw new DispatchException("Slack API error: " + response.getError());
        }
        if (StringUtils.isBlank(response.getTs())) {
            throw new DispatchException("Slack response has no message ts");
        }
        log.debug("Slack message posted: channel={}, ts={}, thread_ts={}", channel, response.getTs(), threadId);
        return response.getTs();
    }

    Map<String, Object> buildPayload(ChatMessage message, String threadId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", channel);
        payload.put("text", message.getText());
        payload.put("unfurl_links", false);
        payload.put("unfurl_media", false);
        if (message.getBlocks() != null && !message.getBlocks().isEmpty()) {
            payload.put("blocks", message.getBlocks());
        }
        if (message.getAttachments() != null && !message.getAttachments().isEmpty()) {
            payload.put("attachments", message.getAttachments());
        }
        if (StringUtils.isNotEmpty(threadId)) {
            payload.put("thread_ts", threadId);
        }
        return payload;
    }
}
