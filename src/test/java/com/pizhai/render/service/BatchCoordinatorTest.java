package com.pizhai.render.service;

import com.pizhai.render.browser.FakeBrowserFactory;
import com.pizhai.render.browser.FakePage;
import com.pizhai.render.compliance.MarkupComplianceGate;
import com.pizhai.render.config.RenderWorkerConfig;
import com.pizhai.render.exception.ErrorKind;
import com.pizhai.render.model.RenderRequest;
import com.pizhai.render.model.RenderResult;
import com.pizhai.render.pool.DefaultBrowserInstancePool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class BatchCoordinatorTest {

    private BatchCoordinator coordinator;

    @AfterEach
    public void tearDown() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    private static RenderResult ok(String markup) {
        return RenderResult.success(markup.getBytes(StandardCharsets.UTF_8), "png", 10, 10, 1, 1.0);
    }

    @Test
    public void concurrencyMustBePositive() {
        RenderingService service = mock(RenderingService.class);

        assertThatThrownBy(() -> new BatchCoordinator(service, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void emptyBatchReturnsEmptyList() {
        coordinator = new BatchCoordinator(mock(RenderingService.class), 2);

        assertThat(coordinator.renderBatch(Collections.emptyList())).isEmpty();
        assertThat(coordinator.renderBatch(null)).isEmpty();
    }

    @Test
    public void resultsFollowRequestOrder() {
        RenderingService service = mock(RenderingService.class);
        when(service.render(any(RenderRequest.class))).thenAnswer(invocation -> {
            RenderRequest request = invocation.getArgument(0);
            // 让靠前的请求更晚完成
            int index = Integer.parseInt(request.getMarkup().substring(1));
            Thread.sleep((10 - index) * 5L);
            return ok(request.getMarkup());
        });
        coordinator = new BatchCoordinator(service, 3);

        List<RenderRequest> requests = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            requests.add(RenderRequest.screenshot("#" + i));
        }
        List<RenderResult> results = coordinator.renderBatch(requests);

        assertThat(results).hasSize(10);
        for (int i = 0; i < 10; i++) {
            assertThat(new String(results.get(i).getArtifact(), StandardCharsets.UTF_8)).isEqualTo("#" + i);
        }
    }

    @Test
    public void oneFailureDoesNotAffectOthers() {
        RenderingService service = mock(RenderingService.class);
        when(service.render(any(RenderRequest.class))).thenAnswer(invocation -> {
            RenderRequest request = invocation.getArgument(0);
            if (request.getMarkup().equals("boom")) {
                throw new IllegalStateException("渲染线程异常");
            }
            return ok(request.getMarkup());
        });
        coordinator = new BatchCoordinator(service, 2);

        List<RenderResult> results = coordinator.renderBatch(List.of(
                RenderRequest.screenshot("a"),
                RenderRequest.screenshot("boom"),
                RenderRequest.screenshot("c")));

        assertThat(results).extracting(RenderResult::isSuccess).containsExactly(true, false, true);
        assertThat(results.get(1).getErrorKind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
        assertThat(results.get(1).getMessage()).contains("渲染线程异常");
    }

    @Test
    public void neverRunsMoreThanConcurrencyAtOnce() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        RenderingService service = mock(RenderingService.class);
        when(service.render(any(RenderRequest.class))).thenAnswer(invocation -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            running.decrementAndGet();
            return ok("x");
        });
        coordinator = new BatchCoordinator(service, 3);

        List<RenderRequest> requests = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            requests.add(RenderRequest.pdf("x"));
        }
        List<RenderResult> results = coordinator.renderBatch(requests);

        assertThat(results).hasSize(12).allMatch(RenderResult::isSuccess);
        assertThat(peak.get()).isLessThanOrEqualTo(3);
    }

    @Test
    public void batchAgainstRealPoolIsolatesBrokenMarkup() {
        RenderWorkerConfig config = RenderWorkerConfig.builder()
                .poolMin(1)
                .poolMax(2)
                .sweepIntervalMillis(0)
                .acquireRetryMillis(20)
                .build();
        FakeBrowserFactory factory = new FakeBrowserFactory();
        try (DefaultBrowserInstancePool pool = DefaultBrowserInstancePool.builder()
                .browserFactory(factory)
                .config(config)
                .build()) {
            RenderingService service = new RenderingService(pool, new MarkupComplianceGate(), config);
            coordinator = new BatchCoordinator(service, 3);

            List<RenderRequest> requests = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                String markup = "<p>slide " + i + "</p>" + (i == 4 ? FakePage.FAIL_LOAD : "");
                requests.add(RenderRequest.pdf(markup));
            }
            List<RenderResult> results = coordinator.renderBatch(requests);

            assertThat(results).extracting(RenderResult::isSuccess)
                    .containsExactly(true, true, true, true, false, true);
            assertThat(results.get(4).getErrorKind()).isEqualTo(ErrorKind.PAGE_LOAD_TIMEOUT);
            assertThat(pool.statistics().getInUse()).isZero();
            assertThat(factory.launchCount()).isLessThanOrEqualTo(2);
        }
    }

    @Test
    public void batchAfterCloseFailsEveryItemInsteadOfThrowing() {
        RenderingService service = mock(RenderingService.class);
        when(service.render(any(RenderRequest.class))).thenAnswer(invocation -> ok("x"));
        coordinator = new BatchCoordinator(service, 2);
        coordinator.close();

        List<RenderResult> results = coordinator.renderBatch(List.of(
                RenderRequest.screenshot("a"),
                RenderRequest.screenshot("b"),
                RenderRequest.pdf("c")));

        assertThat(results).hasSize(3).noneMatch(RenderResult::isSuccess);
        assertThat(results).extracting(RenderResult::getErrorKind).containsOnly(ErrorKind.POOL_SHUT_DOWN);
        verify(service, never()).render(any(RenderRequest.class));
    }
}
