package com.pizhai.render;

import com.pizhai.render.config.RenderWorkerConfig;
import com.pizhai.render.model.ImageFormat;
import com.pizhai.render.model.RenderRequest;
import com.pizhai.render.model.RenderResult;
import com.pizhai.render.model.ScreenshotOptions;
import com.pizhai.render.util.ChromeEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 命令行入口
 *
 * <pre>
 * screenshot &lt;input.html&gt; &lt;output.png|output.jpg&gt;
 * pdf        &lt;input.html&gt; &lt;output.pdf&gt;
 * slide-pdf  &lt;input.html&gt; &lt;output.pdf&gt;
 * batch      &lt;output-dir&gt; &lt;input.html&gt;...
 * health
 * </pre>
 */
public class Main {

    // 必须在第一次获取Logger之前设置
    static {
        // 配置SLF4J Simple日志级别
        java.util.Properties properties = new java.util.Properties();
        properties.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "info");
        properties.setProperty("org.slf4j.simpleLogger.showDateTime", "true");
        properties.setProperty("org.slf4j.simpleLogger.dateTimeFormat", "yyyy-MM-dd HH:mm:ss.SSS");
        properties.setProperty("org.slf4j.simpleLogger.showThreadName", "true");
        properties.setProperty("org.slf4j.simpleLogger.showLogName", "true");
        properties.setProperty("org.slf4j.simpleLogger.showShortLogName", "true");

        // 设置各包的日志级别
        properties.setProperty("org.slf4j.simpleLogger.log.com.pizhai.render.cdp", "info");
        properties.setProperty("org.slf4j.simpleLogger.log.com.pizhai.render.chrome", "info");
        properties.setProperty("org.slf4j.simpleLogger.log.org.java_websocket", "warn");

        // 应用配置，已通过-D指定的保持不变
        for (String name : properties.stringPropertyNames()) {
            if (System.getProperty(name) == null) {
                System.setProperty(name, properties.getProperty(name));
            }
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return 2;
        }

        RenderWorkerConfig config = RenderWorkerConfig.load();
        String command = args[0];

        if ("health".equals(command)) {
            return health(config);
        }

        if (!ChromeEnvironment.checkEnvironment(config.getChromePath())) {
            logger.error("Chrome不可用，请设置CHROME_PATH环境变量");
            return 1;
        }

        try (RenderWorker worker = RenderWorker.start(config).registerShutdownHook()) {
            switch (command) {
                case "screenshot":
                case "pdf":
                case "slide-pdf":
                    if (args.length < 3) {
                        printUsage();
                        return 2;
                    }
                    return renderSingle(worker, command, Paths.get(args[1]), Paths.get(args[2]));
                case "batch":
                    if (args.length < 3) {
                        printUsage();
                        return 2;
                    }
                    List<Path> inputs = new ArrayList<>();
                    for (int i = 2; i < args.length; i++) {
                        inputs.add(Paths.get(args[i]));
                    }
                    return renderBatch(worker, Paths.get(args[1]), inputs);
                default:
                    printUsage();
                    return 2;
            }
        } catch (IOException e) {
            logger.error("读写文件失败: {}", e.getMessage());
            return 1;
        }
    }

    private static int renderSingle(RenderWorker worker, String command, Path input, Path output) throws IOException {
        String html = readHtml(input);
        RenderResult result;
        switch (command) {
            case "screenshot":
                result = worker.getRenderingService().screenshot(html, ScreenshotOptions.builder()
                        .format(formatFor(output))
                        .build());
                break;
            case "pdf":
                result = worker.getRenderingService().pdf(html, null);
                break;
            default:
                result = worker.getRenderingService().slidePdf(html);
                break;
        }
        return writeResult(result, output);
    }

    private static int renderBatch(RenderWorker worker, Path outputDir, List<Path> inputs) throws IOException {
        Files.createDirectories(outputDir);

        List<RenderRequest> requests = new ArrayList<>();
        for (Path input : inputs) {
            requests.add(RenderRequest.screenshot(readHtml(input)).withLabel(input.getFileName().toString()));
        }

        List<RenderResult> results = worker.getBatchCoordinator().renderBatch(requests);
        int failures = 0;
        for (int i = 0; i < results.size(); i++) {
            String name = stripExtension(inputs.get(i).getFileName().toString()) + ".png";
            if (writeResult(results.get(i), outputDir.resolve(name)) != 0) {
                failures++;
            }
        }
        logger.info("批量渲染结束，失败 {} 项", failures);
        return failures == 0 ? 0 : 1;
    }

    private static int health(RenderWorkerConfig config) {
        boolean chromeAvailable = ChromeEnvironment.checkEnvironment(config.getChromePath());
        if (!chromeAvailable) {
            logger.error("Chrome不可用");
            return 1;
        }
        try (RenderWorker worker = RenderWorker.start(config)) {
            System.out.println(worker.getHealthReporter().report().toJson());
        }
        return 0;
    }

    private static int writeResult(RenderResult result, Path output) throws IOException {
        if (!result.isSuccess()) {
            logger.error("渲染失败 {}: [{}] {}", output, result.getErrorKind().getCode(), result.getMessage());
            return 1;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] artifact = result.getArtifact();
        Files.write(output, artifact);
        logger.info("已保存 {} ({} 字节, {} ms)", output, artifact.length, result.getRenderDurationMs());
        return 0;
    }

    private static String readHtml(Path input) throws IOException {
        if (!Files.isRegularFile(input)) {
            throw new IOException("HTML文件不存在: " + input);
        }
        return new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
    }

    private static ImageFormat formatFor(Path output) {
        String name = output.getFileName().toString().toLowerCase();
        return name.endsWith(".jpg") || name.endsWith(".jpeg") ? ImageFormat.JPEG : ImageFormat.PNG;
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void printUsage() {
        System.out.println("用法:");
        System.out.println("  screenshot <input.html> <output.png|output.jpg>");
        System.out.println("  pdf        <input.html> <output.pdf>");
        System.out.println("  slide-pdf  <input.html> <output.pdf>");
        System.out.println("  batch      <output-dir> <input.html>...");
        System.out.println("  health");
    }
}
