package com.taskquery.suggest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.taskquery.query.FilterField;
import com.taskquery.task.Task;
import java.lang.reflect.Constructor;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchSuggestionsTest {

    private final List<Task> tasks = List.of(
            Task.of("projects/alpha/plan.md", "draft #work/q3"),
            Task.of("projects/beta.md", "review #work #review"),
            Task.of("inbox.md", "misc"));

    @Test
    void testPathsListParentDirectories() {
        assertEquals(List.of("projects", "projects/alpha"), SearchSuggestions.paths(tasks));
    }

    @Test
    void testFilesAndTags() {
        assertEquals(List.of("beta.md", "inbox.md", "plan.md"), SearchSuggestions.files(tasks));
        assertEquals(List.of("review", "work", "work/q3"), SearchSuggestions.tags(tasks));
    }

    @Test
    void testForField() {
        assertEquals(SearchSuggestions.PRIORITY_OPTIONS, SearchSuggestions.forField(FilterField.PRIORITY, tasks));
        assertEquals(SearchSuggestions.DEFAULT_STATES, SearchSuggestions.forField(FilterField.STATE, tasks));
        assertEquals(SearchSuggestions.DATE_KEYWORDS, SearchSuggestions.forField(FilterField.DEADLINE, tasks));
        assertTrue(SearchSuggestions.forField(FilterField.CONTENT, tasks).isEmpty());
    }

    @Test
    void testFilterIsCaseInsensitive() {
        assertEquals(List.of("DOING", "DONE", "TODO"), SearchSuggestions.filter("do", SearchSuggestions.DEFAULT_STATES));
        assertEquals(SearchSuggestions.DATE_KEYWORDS, SearchSuggestions.filter("", SearchSuggestions.DATE_KEYWORDS));
        assertEquals(SearchSuggestions.DATE_KEYWORDS, SearchSuggestions.filter(null, SearchSuggestions.DATE_KEYWORDS));
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<SearchSuggestions> constructor = SearchSuggestions.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        assertNotNull(constructor.newInstance());
    }
}
