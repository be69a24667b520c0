package alertthreader.threader;

import alertthreader.threader.message.ChatMessage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

class RecordingDispatcher implements NotificationDispatcher {
    private final List<Post> posts = new ArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final Set<String> failingTexts = new HashSet<>();

    /**
     * 纯文本包含该片段的消息发送失败
     */
    synchronized void failWhenTextContains(String fragment) {
        failingTexts.add(fragment);
    }

    @Override
    public String post(ChatMessage message, String threadId) throws DispatchException {
        synchronized (this) {
            for (String fragment : failingTexts) {
                if (message.getText().contains(fragment)) {
                    throw new DispatchException("channel_not_found");
                }
            }
            posts.add(new Post(message.getText(), threadId));
        }
        return "ts-" + sequence.incrementAndGet();
    }

    synchronized List<Post> posts() {
        return new ArrayList<>(posts);
    }

    synchronized long newThreads() {
        return posts.stream().filter(post -> post.threadId == null).count();
    }

    static final class Post {
        final String text;
        final String threadId;

        Post(String text, String threadId) {
            this.text = text;
            this.threadId = threadId;
        }
    }
}
