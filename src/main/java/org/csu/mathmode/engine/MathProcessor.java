package org.csu.mathmode.engine;

import lombok.Getter;
import org.csu.mathmode.common.config.MathConfig;
import org.csu.mathmode.common.exception.MathException;
import org.csu.mathmode.compiler.lexer.MathLexer;
import org.csu.mathmode.compiler.lexer.SyntaxConstituent;
import org.csu.mathmode.compiler.parser.MathParser;
import org.csu.mathmode.compiler.parser.ast.ExpressionNode;
import org.csu.mathmode.compiler.semantic.MathScope;
import org.csu.mathmode.content.ContentElement;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * 数学区间处理器
 * 驱动完整流水线：词法分析 -> 分类 -> 语法分析 -> 名称解析与内容构建。
 *
 * 各区间相互独立，一个区间失败不影响其他区间。
 */
public class MathProcessor {

    @Getter
    private final MathConfig config;
    @Getter
    private final MathScope scope;
    @Getter
    private final DisplayCoercion coercion;
    private final ContentBuilder builder;

    public MathProcessor() {
        this(MathConfig.defaults());
    }

    public MathProcessor(MathConfig config) {
        this(config, StandardLibrary.scope(), new DefaultDisplayCoercion());
    }

    public MathProcessor(MathConfig config, MathScope scope, DisplayCoercion coercion) {
        this.config = config;
        this.scope = scope;
        this.coercion = coercion;
        this.builder = new ContentBuilder(new EvalContext(scope, coercion));
    }

    /**
     * 处理一段数学源码。
     */
    public MathResult process(String source) {
        return process(source, new MathLexer(source).tokenize());
    }

    /**
     * 处理上游已切分好的节点序列，source 仅用于结果和日志。
     */
    public MathResult process(String source, List<SyntaxConstituent> constituents) {
        try {
            ExpressionNode tree = MathParser.parseConstituents(constituents, config);
            ContentElement content = builder.build(tree);
            if (config.debug()) {
                System.out.println("[MathProcessor] '" + abbreviate(source) + "' -> " + content.plainText());
            }
            return MathResult.success(source, content);
        } catch (MathException e) {
            if (config.debug()) {
                System.err.println("[MathProcessor] '" + abbreviate(source) + "' failed: " + e.getMessage());
            }
            return MathResult.failure(source, e);
        } catch (RuntimeException e) {
            // 外部提供的函数或显示转换出错，只中止当前区间
            System.err.println("[MathProcessor] Unexpected error in '" + abbreviate(source) + "': " + e);
            return MathResult.failure(source, e);
        }
    }

    /**
     * 依次处理多个区间，收集所有失败而不是在第一个错误处停止。
     */
    public List<MathResult> processAll(List<String> sources) {
        List<MathResult> results = new ArrayList<>(sources.size());
        for (String source : sources) {
            results.add(processIsolated(source));
        }
        logSummary(results);
        return results;
    }

    /**
     * 在给定线程池上并发处理多个区间，结果顺序与输入一致。
     */
    public List<MathResult> processAll(List<String> sources, ExecutorService executor) {
        List<CompletableFuture<MathResult>> futures = sources.stream()
                .map(source -> CompletableFuture.supplyAsync(() -> processIsolated(source), executor)
                        .handle((result, error) -> error == null ? result : MathResult.failure(source, asRuntime(error))))
                .collect(Collectors.toList());
        List<MathResult> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
        logSummary(results);
        return results;
    }

    /**
     * 批处理中的单个区间：连线程栈耗尽也只算作该区间失败。
     */
    private MathResult processIsolated(String source) {
        try {
            return process(source);
        } catch (StackOverflowError e) {
            System.err.println("[MathProcessor] Stack exhausted while processing '" + abbreviate(source) + "'");
            return MathResult.failure(source, new IllegalStateException("Expression nested too deeply to process", e));
        }
    }

    private static RuntimeException asRuntime(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Span processing failed", cause);
    }

    private static String abbreviate(String source) {
        return source.length() <= 40 ? source : source.substring(0, 40) + "...";
    }

    /**
     * @return 结果中的全部错误，按输入顺序
     */
    public static List<RuntimeException> failures(List<MathResult> results) {
        return results.stream()
                .filter(result -> !result.isSuccess())
                .map(MathResult::error)
                .collect(Collectors.toList());
    }

    private void logSummary(List<MathResult> results) {
        if (config.debug()) {
            long failed = results.stream().filter(result -> !result.isSuccess()).count();
            System.out.println("[MathProcessor] Processed " + results.size() + " spans, " + failed + " failed.");
        }
    }
}
