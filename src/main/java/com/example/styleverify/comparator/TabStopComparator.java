package com.example.styleverify.comparator;

import com.example.styleverify.model.FieldDifference;
import com.example.styleverify.model.MismatchCategory;
import com.example.styleverify.model.TabStop;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares tab stop sequences index by index; order is significant. Stop positions count only
 * when both sides report one.
 */
@Component
@Order(3)
public class TabStopComparator implements StyleComparator {

    public static final String COUNT_MISMATCH = "TabStopCountMismatch";
    public static final String STOP_MISMATCH = "TabStopMismatch";

    @Override
    public String name() {
        return "tab-stop";
    }

    @Override
    public MismatchCategory category() {
        return MismatchCategory.TAB_STOP;
    }

    @Override
    public List<FieldDifference> compare(ComparedStyle expected, ComparedStyle actual) {
        List<TabStop> expectedStops = expected.tabStops();
        List<TabStop> actualStops = actual.tabStops();
        List<FieldDifference> differences = new ArrayList<>();

        if (expectedStops.size() != actualStops.size()) {
            differences.add(new FieldDifference(COUNT_MISMATCH,
                    String.valueOf(expectedStops.size()), String.valueOf(actualStops.size())));
        }
        int common = Math.min(expectedStops.size(), actualStops.size());
        for (int i = 0; i < common; i++) {
            TabStop expectedStop = expectedStops.get(i);
            TabStop actualStop = actualStops.get(i);
            if (!expectedStop.matches(actualStop)) {
                differences.add(new FieldDifference(STOP_MISMATCH + "[" + i + "]",
                        expectedStop.describe(), actualStop.describe()));
            }
        }
        return differences;
    }
}
