package org.nowstart.dca.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.dca.service.DcaWorkflowService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DcaScheduler {

    private final DcaWorkflowService dcaWorkflowService;

    @Scheduled(fixedDelayString = "${dca.interval:1h}")
    public void run() {
        dcaWorkflowService.runOnce();
    }
}
