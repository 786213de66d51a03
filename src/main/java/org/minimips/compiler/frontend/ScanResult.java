package org.minimips.compiler.frontend;

import org.minimips.compiler.api.SourceInfo;

import java.util.List;
import java.util.Map;

/**
 * The output of the {@link SegmentScanner}: the raw {@code .text} lines and the
 * complete label and data tables, ready for instruction decoding.
 *
 * @param textLines The instruction lines in source order.
 * @param labels Text labels mapped to instruction indices.
 * @param dataAddresses Data labels mapped to addresses.
 * @param dataContents String payloads by address.
 */
public record ScanResult(
        List<SourceInfo> textLines,
        Map<String, Integer> labels,
        Map<String, Integer> dataAddresses,
        Map<Integer, String> dataContents
) {}
