package com.taskquery.task;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 读取 JSON 数组形式的任务列表，日期字段使用 ISO 格式（yyyy-MM-dd）。
 */
public class TaskListReader {
    private static final Logger logger = LoggerFactory.getLogger(TaskListReader.class);
    private static final TypeReference<List<Task>> TASK_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public TaskListReader() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public List<Task> read(Path file) {
        try {
            List<Task> tasks = mapper.readValue(file.toFile(), TASK_LIST);
            if (tasks == null) {
                return List.of();
            }
            logger.debug("已读取任务列表: {} ({} 条)", file, tasks.size());
            return tasks;
        } catch (IOException ioException) {
            throw new IllegalStateException("读取任务列表失败: " + file, ioException);
        }
    }

    public List<Task> read(String json) {
        try {
            List<Task> tasks = mapper.readValue(json, TASK_LIST);
            return tasks == null ? List.of() : tasks;
        } catch (IOException ioException) {
            throw new IllegalStateException("解析任务列表失败", ioException);
        }
    }
}
