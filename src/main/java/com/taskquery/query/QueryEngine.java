package com.taskquery.query;

import com.taskquery.config.Constants;
import com.taskquery.config.SearchSettings;
import com.taskquery.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 查询门面：parse / validate / getError / evaluate，并持有 AST 缓存。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final AstCache astCache;

    /**
     * 使用默认容量的 AST 缓存构造查询引擎。
     */
    public QueryEngine() {
        this(new AstCache(Constants.AST_CACHE_CAPACITY));
    }

    /**
     * 使用外部持有的缓存实例构造，多个引擎可以共享同一缓存。
     */
    public QueryEngine(AstCache astCache) {
        this.astCache = astCache;
    }

    /**
     * 解析查询并缓存结果；语法错误抛出 {@link QueryParseException}。
     */
    public QueryNode parse(String query) {
        String key = query == null ? "" : query;
        return astCache.computeIfAbsent(key, missed -> {
            logger.debug("AST 缓存未命中: {}", missed);
            return new QueryParser().parse(missed);
        });
    }

    public boolean validate(String query) {
        return getError(query) == null;
    }

    /**
     * 返回语法错误信息，查询合法时返回 null。
     */
    public String getError(String query) {
        try {
            parse(query);
            return null;
        } catch (QueryParseException parseException) {
            return parseException.getMessage();
        }
    }

    public CompletableFuture<Boolean> evaluate(String query, Task task) {
        return evaluate(query, task, false, null);
    }

    public CompletableFuture<Boolean> evaluate(String query, Task task, boolean caseSensitive) {
        return evaluate(query, task, caseSensitive, null);
    }

    /**
     * 判断任务是否匹配查询。语法错误的查询不匹配任何任务；其他异常（如属性查询失败）原样传播。
     *
     * @param settings 为 null 时使用默认配置
     */
    public CompletableFuture<Boolean> evaluate(String query, Task task, boolean caseSensitive, SearchSettings settings) {
        QueryNode ast;
        try {
            ast = parse(query);
        } catch (QueryParseException parseException) {
            logger.debug("查询语法错误，按不匹配处理: {} - {}", query, parseException.getMessage());
            return CompletableFuture.completedFuture(false);
        }
        return new QueryEvaluator(caseSensitive, settings).evaluate(ast, task);
    }

    /**
     * 对每个任务并发发起一次求值，按输入顺序返回匹配的任务。
     */
    public CompletableFuture<List<Task>> filter(String query, List<Task> tasks, boolean caseSensitive,
                                                SearchSettings settings) {
        List<CompletableFuture<Boolean>> pending = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            pending.add(evaluate(query, task, caseSensitive, settings));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<Task> matched = new ArrayList<>();
                    for (int i = 0; i < tasks.size(); i++) {
                        if (pending.get(i).join()) {
                            matched.add(tasks.get(i));
                        }
                    }
                    return matched;
                });
    }

    public AstCache getAstCache() {
        return astCache;
    }

    public void clearCache() {
        astCache.clear();
    }
}
