package com.taskquery.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskquery.config.Constants;
import com.taskquery.config.SearchSettings;
import com.taskquery.property.JsonPropertyStore;
import com.taskquery.query.FilterField;
import com.taskquery.query.LexToken;
import com.taskquery.query.QueryEngine;
import com.taskquery.query.QueryLexer;
import com.taskquery.query.QueryNodes;
import com.taskquery.query.QueryParseException;
import com.taskquery.suggest.SearchSuggestions;
import com.taskquery.task.Task;
import com.taskquery.task.TaskListReader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "tq",
    description = "🗂️ 任务查询语言：按文本、短语、前缀、标签、日期与文档属性筛选任务",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ValidateSubcommand.class,
        MainCommand.ParseSubcommand.class,
        MainCommand.FilterSubcommand.class,
        MainCommand.SuggestSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--week-start"}, description = "每周起始日 (MONDAY|SUNDAY)", defaultValue = "MONDAY")
    private DayOfWeek weekStart;

    private final QueryEngine queryEngine = new QueryEngine();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🗂️ 任务查询语言");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private SearchSettings buildSettings() {
        SearchSettings settings = SearchSettings.defaults();
        DayOfWeek effective = weekStart == null ? Constants.DEFAULT_WEEK_START : weekStart;
        if (effective != DayOfWeek.MONDAY && effective != DayOfWeek.SUNDAY) {
            System.err.printf("⚠️ 每周起始日 %s 不受支持，已回退为 %s%n", effective, Constants.DEFAULT_WEEK_START);
            effective = Constants.DEFAULT_WEEK_START;
        }
        settings.setWeekStartsOn(effective);
        return settings;
    }

    private String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return trimmed;
    }

    private static void printParseError(QueryParseException parseException) {
        System.err.println("❌ " + parseException.describe());
        System.err.println("💡 " + parseException.getSuggestion());
    }

    @Command(name = "validate", description = "✅ 检查查询语法")
    static class ValidateSubcommand implements Callable<Integer> {

        @Parameters(description = "查询语句", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            String safeQuery = main.sanitizeQuery(query);
            try {
                main.queryEngine.parse(safeQuery);
                System.out.println("✅ 查询合法: " + safeQuery);
                return 0;
            } catch (QueryParseException parseException) {
                printParseError(parseException);
                return 1;
            }
        }
    }

    @Command(name = "parse", description = "🌳 输出 token 序列与语法树")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "查询语句", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            String safeQuery = main.sanitizeQuery(query);
            List<LexToken> tokens = new QueryLexer().tokenize(safeQuery);
            System.out.println("🔤 Tokens:");
            for (LexToken token : tokens) {
                System.out.printf("   %3d  %-20s %s%n", token.position(), token.type(), token.value());
            }
            try {
                System.out.println("🌳 AST: " + QueryNodes.render(main.queryEngine.parse(safeQuery)));
                return 0;
            } catch (QueryParseException parseException) {
                printParseError(parseException);
                return 1;
            }
        }
    }

    @Command(name = "filter", description = "🔎 用查询筛选任务列表")
    static class FilterSubcommand implements Callable<Integer> {

        @Parameters(description = "查询语句", arity = "1")
        private String query;

        @Option(names = {"-t", "--tasks"}, description = "任务列表 JSON 文件", required = true)
        private Path tasksFile;

        @Option(names = {"-p", "--properties"}, description = "文档属性 JSON 文件（路径 -> 属性对象）")
        private Path propertiesFile;

        @Option(names = {"-c", "--case-sensitive"}, description = "区分大小写", defaultValue = "false")
        private boolean caseSensitive;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            String safeQuery = main.sanitizeQuery(query);
            try {
                main.queryEngine.parse(safeQuery);
            } catch (QueryParseException parseException) {
                printParseError(parseException);
                return 1;
            }

            try {
                List<Task> tasks = new TaskListReader().read(tasksFile);
                SearchSettings settings = main.buildSettings();
                if (propertiesFile != null) {
                    settings.setPropertyLookup(JsonPropertyStore.load(propertiesFile));
                }

                long start = System.currentTimeMillis();
                List<Task> matched = main.queryEngine.filter(safeQuery, tasks, caseSensitive, settings).join();
                long elapsed = System.currentTimeMillis() - start;

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(matched);
                } else {
                    System.out.println("🔍 查询: \"" + safeQuery + "\"");
                    System.out.println();
                    printTextResult(matched);
                    System.out.println();
                    System.out.println("📊 共 " + matched.size() + "/" + tasks.size() + " 条匹配，用时 " + elapsed + "ms");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 筛选失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextResult(List<Task> matched) {
            if (matched.isEmpty()) {
                System.out.println("⚠️ 未找到匹配任务");
                return;
            }
            for (Task task : matched) {
                System.out.printf("%s:%d  %s%n", task.path(), task.line(), task.rawText().trim());
            }
        }

        private void printJsonResult(List<Task> matched) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(matched));
        }
    }

    @Command(name = "suggest", description = "💡 列出前缀过滤的补全候选")
    static class SuggestSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "前缀字段 (path|file|tag|state|priority|content|scheduled|deadline)")
        private String field;

        @Parameters(index = "1", description = "已输入的部分值", arity = "0..1")
        private String input;

        @Option(names = {"-t", "--tasks"}, description = "任务列表 JSON 文件")
        private Path tasksFile;

        @Override
        public Integer call() {
            String keyword = field == null ? "" : field.toLowerCase(Locale.ROOT);
            if (keyword.endsWith(":")) {
                keyword = keyword.substring(0, keyword.length() - 1);
            }
            Optional<FilterField> filterField = FilterField.fromKeyword(keyword);
            if (filterField.isEmpty()) {
                System.err.println("❌ 未知前缀字段: " + field);
                return 1;
            }
            try {
                List<Task> tasks = tasksFile == null ? List.of() : new TaskListReader().read(tasksFile);
                List<String> suggestions = SearchSuggestions.filter(input,
                        SearchSuggestions.forField(filterField.get(), tasks));
                if (suggestions.isEmpty()) {
                    System.out.println("⚠️ 没有候选");
                    return 0;
                }
                for (String suggestion : suggestions) {
                    System.out.println(filterField.get().keyword() + ":" + quoteIfNeeded(suggestion));
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取候选失败: " + exception.getMessage());
                return 1;
            }
        }

        private static String quoteIfNeeded(String value) {
            return value.contains(" ") ? "\"" + value + "\"" : value;
        }
    }
}
