package org.nowstart.dca.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.nowstart.dca.data.type.DcaErrorKind;
import org.nowstart.dca.service.DcaOrderHistory;
import org.nowstart.dca.service.DcaWorkflowService;
import org.nowstart.dca.service.dca.core.DcaOrder;
import org.nowstart.dca.service.dca.core.DcaRunResult;
import org.nowstart.dca.service.dca.core.DcaSettings;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dca")
@Tag(name = "DCA", description = "적립식 매수 실행, 설정 조회, 주문 이력 조회 API")
public class DcaController {

    private final DcaWorkflowService dcaWorkflowService;
    private final DcaOrderHistory dcaOrderHistory;

    public DcaController(DcaWorkflowService dcaWorkflowService, DcaOrderHistory dcaOrderHistory) {
        this.dcaWorkflowService = dcaWorkflowService;
        this.dcaOrderHistory = dcaOrderHistory;
    }

    @PostMapping("/run")
    @Operation(summary = "적립식 매수 실행", description = "현재 매수 주기에 주문이 없으면 지정가 매수 주문을 1건 생성합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "주문 생성 성공"),
            @ApiResponse(responseCode = "200", description = "이번 주기에 이미 주문 존재"),
            @ApiResponse(responseCode = "409", description = "시스템 시각과 거래소 시각 불일치"),
            @ApiResponse(responseCode = "422", description = "잔고 부족 또는 최소 주문 수량 미달"),
            @ApiResponse(responseCode = "502", description = "거래소 조회 또는 주문 전송 실패"),
            @ApiResponse(responseCode = "500", description = "주문 이력 저장 실패 또는 예기치 못한 오류")
    })
    public ResponseEntity<DcaRunResult> run() {
        DcaRunResult result = dcaWorkflowService.runOnce();
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    @GetMapping("/settings")
    @Operation(summary = "설정 조회", description = "거래소에서 확인한 페어 정보와 매수 금액/주기 설정을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public DcaSettings getSettings() {
        return dcaWorkflowService.currentSettings();
    }

    @GetMapping("/orders")
    @Operation(summary = "주문 이력 조회", description = "거래소에 접수된 적립식 매수 주문 이력을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public List<DcaOrder> getOrders() {
        return dcaOrderHistory.findAll();
    }

    private HttpStatus statusOf(DcaRunResult result) {
        return switch (result.outcome()) {
            case ORDER_PLACED -> HttpStatus.CREATED;
            case ALREADY_ORDERED -> HttpStatus.OK;
            case FAILED -> statusOf(result.errorKind());
        };
    }

    private HttpStatus statusOf(DcaErrorKind kind) {
        return switch (kind) {
            case CLOCK_SKEW -> HttpStatus.CONFLICT;
            case INSUFFICIENT_FUNDS, ORDER_TOO_SMALL -> HttpStatus.UNPROCESSABLE_ENTITY;
            case SUBMISSION, EXCHANGE_ERROR -> HttpStatus.BAD_GATEWAY;
            case PERSISTENCE, INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
