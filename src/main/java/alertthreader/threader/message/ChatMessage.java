package alertthreader.threader.message;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 渲染后的聊天消息: 纯文本兜底 + Block Kit + 附件
 */
@Getter
@RequiredArgsConstructor
public class ChatMessage {
    private final String text;
    private final List<Map<String, Object>> blocks;
    private final List<Map<String, Object>> attachments;
}
