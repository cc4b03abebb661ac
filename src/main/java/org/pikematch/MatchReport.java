package org.pikematch;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.pikematch.regex.MatchSpan;

import java.util.List;

/**
 * Renders the matches of one run, as text or as JSON.
 *
 * <p>Text:</p>
 * <pre>
 * match
 * offset 0 length 3
 * offset 7 length 3
 * </pre>
 * or the single line {@code no match}.
 *
 * <p>JSON:</p>
 * <pre>
 * {"pattern":"a+","subject":"aab","matched":true,"matches":[{"offset":0,"length":2,"text":"aa"}]}
 * </pre>
 */
public record MatchReport(String pattern, String subject, List<MatchSpan> matches) {

    public MatchReport {
        matches = List.copyOf(matches);
    }

    public boolean matched() {
        return !matches.isEmpty();
    }

    public String toText() {
        if (!matched()) {
            return "no match\n";
        }
        StringBuilder sb = new StringBuilder("match\n");
        for (MatchSpan span : matches) {
            sb.append("offset ").append(span.offset()).append(" length ").append(span.length()).append('\n');
        }
        return sb.toString();
    }

    public String toJson(boolean pretty) {
        JSONObject json = new JSONObject();
        json.put("pattern", pattern);
        json.put("subject", subject);
        json.put("matched", matched());

        JSONArray jsonMatches = new JSONArray();
        for (MatchSpan span : matches) {
            JSONObject jsonMatch = new JSONObject();
            jsonMatch.put("offset", span.offset());
            jsonMatch.put("length", span.length());
            jsonMatch.put("text", span.matchedText(subject));
            jsonMatches.add(jsonMatch);
        }
        json.put("matches", jsonMatches);

        JSONWriter.Feature[] features = pretty ? new JSONWriter.Feature[]{JSONWriter.Feature.PrettyFormat} : new JSONWriter.Feature[0];
        return JSON.toJSONString(json, features);
    }
}
