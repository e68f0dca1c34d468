package org.bpmn2drawio.theme.models;

import java.util.regex.Pattern;

/**
 * Colors a lane whose name matches {@code pattern}, a case-insensitive
 * regular expression searched anywhere in the name.
 */
public record LaneStyleRule(String pattern, String fill, String stroke) {

    public LaneStyleRule {
        Pattern.compile(pattern); // fail early on a bad expression
    }

    public boolean matches(String laneName) {
        return laneName != null
                && Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(laneName).find();
    }
}
