package com.pizhai.render.service;

import com.pizhai.render.exception.ErrorKind;
import com.pizhai.render.model.RenderRequest;
import com.pizhai.render.model.RenderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 批量渲染：按并发上限分批提交，结果顺序与请求顺序一致
 * 单个请求失败只记录为失败结果，不影响其他请求
 */
public class BatchCoordinator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchCoordinator.class);

    private final RenderingService renderingService;
    private final int concurrency;
    private final ExecutorService executor;

    public BatchCoordinator(RenderingService renderingService, int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("批量并发数必须大于0");
        }
        this.renderingService = renderingService;
        this.concurrency = concurrency;

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "batch-render-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 批量渲染
     *
     * @param requests 渲染请求列表
     * @return 与请求一一对应的结果列表
     */
    public List<RenderResult> renderBatch(List<RenderRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return Collections.emptyList();
        }

        long startTime = System.currentTimeMillis();
        List<RenderResult> results = new ArrayList<>(requests.size());

        for (int offset = 0; offset < requests.size(); offset += concurrency) {
            List<RenderRequest> chunk = requests.subList(offset, Math.min(offset + concurrency, requests.size()));
            logger.debug("批量渲染第 {}-{} 项，共 {} 项", offset + 1, offset + chunk.size(), requests.size());
            results.addAll(renderChunk(chunk));
        }

        long succeeded = results.stream().filter(RenderResult::isSuccess).count();
        logger.info("批量渲染完成: 成功 {}/{}，耗时 {} ms",
                succeeded, results.size(), System.currentTimeMillis() - startTime);
        return results;
    }

    private List<RenderResult> renderChunk(List<RenderRequest> chunk) {
        List<Callable<RenderResult>> tasks = new ArrayList<>(chunk.size());
        for (RenderRequest request : chunk) {
            tasks.add(() -> renderingService.render(request));
        }

        List<RenderResult> results = new ArrayList<>(chunk.size());
        List<Future<RenderResult>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("批量渲染被中断");
            for (int i = 0; i < chunk.size(); i++) {
                results.add(RenderResult.failure(ErrorKind.INTERNAL_ERROR, "批量渲染被中断"));
            }
            return results;
        } catch (RejectedExecutionException e) {
            logger.warn("批量渲染已关闭，拒绝 {} 项请求", chunk.size());
            for (int i = 0; i < chunk.size(); i++) {
                results.add(RenderResult.failure(ErrorKind.POOL_SHUT_DOWN, "批量渲染已关闭"));
            }
            return results;
        }

        for (Future<RenderResult> future : futures) {
            results.add(resultOf(future));
        }
        return results;
    }

    private RenderResult resultOf(Future<RenderResult> future) {
        try {
            RenderResult result = future.get();
            return result != null ? result : RenderResult.failure(ErrorKind.INTERNAL_ERROR, "渲染结果为空");
        } catch (ExecutionException e) {
            logger.error("批量渲染项失败", e.getCause());
            return RenderResult.failure(ErrorKind.INTERNAL_ERROR, "渲染失败: " + e.getCause().getMessage());
        } catch (CancellationException e) {
            return RenderResult.failure(ErrorKind.INTERNAL_ERROR, "渲染已取消");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RenderResult.failure(ErrorKind.INTERNAL_ERROR, "批量渲染被中断");
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("批量渲染线程未在30秒内结束，强制关闭");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
