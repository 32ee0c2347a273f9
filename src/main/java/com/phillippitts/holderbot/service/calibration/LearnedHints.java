package com.phillippitts.holderbot.service.calibration;

import java.util.List;

/**
 * Supplies short instruction lines learned from past mistakes, appended to every vision
 * oracle instruction.
 */
@FunctionalInterface
public interface LearnedHints {

    List<String> hints();

    LearnedHints NONE = List::of;
}
