package alertthreader.web;

import alertthreader.threader.AlertOutcome;
import lombok.Getter;

import java.util.List;

@Getter
public class AlertBatchResponse {
    private final boolean ok = true;
    private final int count;
    private final String status;
    private final List<AlertOutcome> results;

    AlertBatchResponse(String status, List<AlertOutcome> results) {
        this.count = results.size();
        this.status = status;
        this.results = results;
    }
}
