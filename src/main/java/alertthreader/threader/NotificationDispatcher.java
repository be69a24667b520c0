package alertthreader.threader;

import alertthreader.threader.message.ChatMessage;

/**
 * 聊天消息发送
 */
public interface NotificationDispatcher {
    /**
     * 发送消息. threadId为null时创建新的顶层消息, 否则作为该线程的回复
     *
     * @return 聊天服务分配的消息ID, 新建线程时即为线程ID
     */
    String post(ChatMessage message, String threadId) throws DispatchException;
}
