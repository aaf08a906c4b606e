package org.nowstart.dca.scheduler;

import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.dca.service.DcaWorkflowService;

@ExtendWith(MockitoExtension.class)
class DcaSchedulerTest {

    @Mock
    private DcaWorkflowService dcaWorkflowService;

    @Test
    void run_delegatesToWorkflowService() {
        DcaScheduler scheduler = new DcaScheduler(dcaWorkflowService);

        scheduler.run();

        verify(dcaWorkflowService).runOnce();
    }
}
