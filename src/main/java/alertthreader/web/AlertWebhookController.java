package alertthreader.web;

import alertthreader.threader.AlertEvent;
import alertthreader.threader.AlertOutcome;
import alertthreader.threader.AlertStatus;
import alertthreader.threader.ThreadRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 接收 Alertmanager 的 Webhook
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AlertWebhookController {

    private final ThreadRouter threadRouter;

    @PostMapping("/alert")
    public AlertBatchResponse receiveAlerts(@RequestBody AlertWebhookRequest webhook) {
        // 先校验整个批次, 有任何问题都不处理单条告警
        AlertStatus batchStatus = AlertWebhookRequest.parseStatus(webhook.getStatus());
        List<AlertEvent> events = webhook.toEvents(batchStatus);

        log.info("Received {} alerts with status: {}", events.size(), batchStatus);
        List<AlertOutcome> outcomes = threadRouter.route(events);

        long failed = outcomes.stream().filter(outcome -> !outcome.isOk()).count();
        if (failed > 0) {
            log.warn("{} of {} alerts failed to deliver", failed, outcomes.size());
        }
        return new AlertBatchResponse(batchStatus.value(), outcomes);
    }
}
