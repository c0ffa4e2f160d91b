package github.sarthakdev143.music_video.model;

import java.util.List;
import java.util.Map;

public record VisualContinuityReport(
        String summary,
        String overallVerdict,
        Double overallScore,
        Map<String, String> checklist,
        List<VisualContinuityIssue> issues) {

    public VisualContinuityReport {
        checklist = checklist == null ? Map.of() : Map.copyOf(checklist);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
