package com.siteaudit.scan.booking;

import com.siteaudit.scan.model.DetectionMethod;

import java.util.Optional;

/**
 * One step of the booking platform waterfall. Stages are tried in order and the first match wins.
 */
public interface BookingDetectionStage {
    DetectionMethod method();

    Optional<StageMatch> detect(DetectionContext context);
}
