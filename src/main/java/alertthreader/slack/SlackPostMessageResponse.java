package alertthreader.slack;

import lombok.Data;

/**
 * chat.postMessage 响应
 */
@Data
public class SlackPostMessageResponse {
    private boolean ok;
    private String ts;
    private String channel;
    private String error;
}
