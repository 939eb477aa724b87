package main;

import static org.junit.Assert.assertEquals;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import analysis.dataflow.interprocedural.biabduction.BiAbductionDomain;

public class AnalysisMainTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static String fixture() throws URISyntaxException {
        return Paths.get(AnalysisMainTest.class.getResource("/programs/null_example.json").toURI()).toString();
    }

    private static JSONArray readIssues(File f) throws Exception {
        return new JSONArray(new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8));
    }

    @Test
    public void testRunWritesIssues() throws Exception {
        File issues = tmp.newFile("issues.json");
        String cache = tmp.newFolder("cache").getPath();
        String[] args = { "-j", "2", "-cache", cache, "-issues", issues.getPath(), fixture() };

        assertEquals(0, AnalysisMain.run(AnalysisOptions.getOptions(args)));
        JSONArray first = readIssues(issues);
        assertEquals(1, first.length());
        JSONObject issue = first.getJSONObject(0);
        assertEquals(BiAbductionDomain.NULL_DEREFERENCE, issue.getString("kind"));

        // warm run reports the same issues from the cache
        assertEquals(0, AnalysisMain.run(AnalysisOptions.getOptions(args)));
        assertEquals(first.toString(), readIssues(issues).toString());
    }

    @Test
    public void testThreadIsolationGivesSameIssues() throws Exception {
        File processIssues = tmp.newFile("process.json");
        File threadIssues = tmp.newFile("thread.json");
        assertEquals(0, AnalysisMain.run(AnalysisOptions.getOptions(new String[] { "-issues", processIssues.getPath(),
                fixture() })));
        assertEquals(0, AnalysisMain.run(AnalysisOptions.getOptions(new String[] { "-isolation", "thread", "-issues",
                threadIssues.getPath(), fixture() })));
        assertEquals(readIssues(processIssues).toString(), readIssues(threadIssues).toString());
    }

    @Test
    public void testMissingInput() throws Exception {
        String missing = new File(tmp.getRoot(), "missing.json").getPath();
        assertEquals(AnalysisMain.BAD_INPUT, AnalysisMain.run(AnalysisOptions.getOptions(new String[] { missing })));
    }

    @Test
    public void testNoInput() {
        assertEquals(AnalysisMain.BAD_INPUT, AnalysisMain.run(AnalysisOptions.getOptions(new String[0])));
    }

    @Test
    public void testUnknownChecker() throws Exception {
        String[] args = { "-c", "taint", fixture() };
        assertEquals(AnalysisMain.BAD_INPUT, AnalysisMain.run(AnalysisOptions.getOptions(args)));
    }
}
