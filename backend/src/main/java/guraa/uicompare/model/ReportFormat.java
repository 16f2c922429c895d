package guraa.uicompare.model;

/**
 * Formatting helpers shared by the result reports.
 */
public final class ReportFormat {

    private ReportFormat() {
    }

    /**
     * Format a 0..1 score as a whole percentage, truncating toward zero.
     */
    public static String percent(double value) {
        return (int) (value * 100) + "%";
    }
}
