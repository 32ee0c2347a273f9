package com.phillippitts.holderbot.service.aggregation;

import java.util.List;

/**
 * Fixed set of photograph regions sent to the oracle, each a fractional box
 * {@code (left, top, right, bottom)} of the photograph with its own focus instruction.
 *
 * <p>The junction regions cover the sign-to-pole mounting zones, where the pole material is
 * usually most visible.
 */
public enum AnalysisRegion {

    FULL("full", 0.0, 0.0, 1.0, 1.0,
            "Analyze the complete pole structure: the vertical support holding the traffic signs. "
                    + "Ignore ground surfaces, sidewalks and background."),
    UPPER_JUNCTION("upper-junction", 0.35, 0.15, 0.65, 0.45,
            "This crop shows the top mounting between sign and pole. Judge only the vertical pole shaft: "
                    + "smooth, thin, round or octagonal usually means metal; thick, rough or square means concrete."),
    MAIN_JUNCTION("main-junction", 0.30, 0.25, 0.70, 0.55,
            "This crop shows the main mounting zone, usually the best view of the pole. Look past the "
                    + "brackets at the pole surface, diameter and shape. Ignore concrete pavement and walls."),
    LOWER_JUNCTION("lower-junction", 0.35, 0.35, 0.65, 0.65,
            "This crop shows the bottom mounting between sign and pole. Judge the pole shaft below the "
                    + "hardware: metallic shine, galvanization or rust indicate metal."),
    CENTER_SHAFT("center-shaft", 0.40, 0.30, 0.60, 0.80,
            "This crop shows the bare central pole shaft away from mounting hardware. "
                    + "Judge surface texture and color of the pole itself."),
    UPPER_SECTION("upper-section", 0.35, 0.00, 0.65, 0.40,
            "This crop shows the upper pole section including sign connections. "
                    + "Judge the material of the vertical support."),
    BASE_SECTION("base-section", 0.40, 0.60, 0.60, 1.00,
            "This crop shows the pole near ground level. Ignore concrete sidewalks and ground "
                    + "surfaces; judge only the vertical pole.");

    static final String PREAMBLE = "You classify the pole (holder) that carries traffic signs in a "
            + "street photograph. Decide its material and its holder type.";

    static final String REPLY_FORMAT = "Reply in exactly four lines:\n"
            + "Material: <material, e.g. kov|betón|drevo|plast>\n"
            + "Type: <holder type, e.g. stĺp značky samostatný|stĺp značky dvojitý|stĺp verejného osvetlenia>\n"
            + "Confidence: <0.0-1.0>\n"
            + "Reasoning: <one short sentence about what you see>";

    private final String regionName;
    private final double left;
    private final double top;
    private final double right;
    private final double bottom;
    private final String focus;

    AnalysisRegion(String regionName, double left, double top, double right, double bottom, String focus) {
        this.regionName = regionName;
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
        this.focus = focus;
    }

    public String regionName() {
        return regionName;
    }

    public double left() {
        return left;
    }

    public double top() {
        return top;
    }

    public double right() {
        return right;
    }

    public double bottom() {
        return bottom;
    }

    /**
     * Full instruction for this region, with learned hints appended when present.
     */
    public String instruction(List<String> hints) {
        StringBuilder sb = new StringBuilder(PREAMBLE).append("\n\n").append(focus);
        if (hints != null && !hints.isEmpty()) {
            sb.append("\n\nLearned from past corrections:");
            for (String hint : hints) {
                sb.append("\n- ").append(hint);
            }
        }
        sb.append("\n\n").append(REPLY_FORMAT);
        return sb.toString();
    }
}
