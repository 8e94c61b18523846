package ucdsafety;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.reflect.TypeToken;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the shared cases in safety_cases.json against the bundled Unicode 14.0 snapshot.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SafetyCasesTest {

    private UnicodeSafety safety;
    private List<TestCase> testCases;

    static class TestCase {
        int id;
        String kind;
        String level;
        String input;
        String allowed;
        String description;
        // boolean for identifier and string cases, the fixed string for confusion cases
        JsonElement expected;
    }

    @BeforeAll
    void setUp() throws IOException {
        safety = UnicodeSafety.loadResource("ucd_snapshot.json");

        Gson gson = new Gson();
        Type listType = new TypeToken<List<TestCase>>() {}.getType();
        InputStream in = SafetyCasesTest.class.getClassLoader().getResourceAsStream("safety_cases.json");
        assertNotNull(in, "safety_cases.json not on the test classpath");
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            testCases = gson.fromJson(reader, listType);
        }
    }

    @Test
    void testAllCasesMatchExpected() {
        StringBuilder failures = new StringBuilder();
        int failCount = 0;

        for (TestCase tc : testCases) {
            String mismatch = mismatch(tc);
            if (mismatch != null) {
                failCount++;
                failures.append(mismatch);
            }
        }

        if (failCount > 0) {
            fail(String.format("%d/%d test cases failed:%n%s", failCount, testCases.size(), failures));
        }
    }

    @Test
    void testCasesCoverEveryKind() {
        assertTrue(testCases.stream().anyMatch(tc -> "identifier".equals(tc.kind)));
        assertTrue(testCases.stream().anyMatch(tc -> "string".equals(tc.kind)));
        assertTrue(testCases.stream().anyMatch(tc -> "confusion".equals(tc.kind)));
    }

    @Test
    void testConfusionCasesAgreeWithDetection() {
        for (TestCase tc : testCases) {
            if (!"confusion".equals(tc.kind)) continue;
            boolean changed = !tc.input.equals(tc.expected.getAsString());
            assertEquals(changed, safety.isIntentionalConfusion(tc.input), "[" + tc.id + "] " + tc.description);
        }
    }

    @Test
    void testCaseWithoutExpectedValueIsReportedNotThrown() {
        TestCase tc = new TestCase();
        tc.id = 999;
        tc.kind = "identifier";
        tc.level = "ascii";
        tc.input = "abc";
        tc.description = "No expected value";

        String mismatch = mismatch(tc);
        assertNotNull(mismatch);
        assertTrue(mismatch.startsWith("[999] No expected value"), mismatch);
    }

    /**
     * Failure report for one case, or null if it passes. Exceptions count as the actual result.
     */
    private String mismatch(TestCase tc) {
        Object expected;
        Object actual;
        try {
            expected = expectedOf(tc);
            actual = run(tc);
        } catch (RuntimeException e) {
            expected = tc.expected;
            actual = e;
        }
        if (Objects.equals(expected, actual)) return null;

        return String.format("[%d] %s (%s %s)%n", tc.id, tc.description, tc.kind, tc.level)
            + String.format("  Input: %s%n", tc.input)
            + String.format("  Expected: %s%n", expected)
            + String.format("  Actual: %s%n", actual);
    }

    private static Object expectedOf(TestCase tc) {
        return "confusion".equals(tc.kind) ? tc.expected.getAsString() : (Object) tc.expected.getAsBoolean();
    }

    private Object run(TestCase tc) {
        AllowList allowList = tc.allowed == null ? AllowList.NONE : AllowList.of(tc.allowed);
        switch (tc.kind) {
            case "identifier":
                return safety.isSafeIdentifier(tc.input, tc.level, allowList);
            case "string":
                return safety.isSafeString(tc.input, tc.level, allowList);
            case "confusion":
                return safety.fixIntentionalConfusion(tc.input);
            default:
                throw new IllegalArgumentException("Unknown case kind: " + tc.kind);
        }
    }
}
