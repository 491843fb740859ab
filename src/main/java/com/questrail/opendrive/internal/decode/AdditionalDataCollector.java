package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.DataQuality;
import com.questrail.opendrive.model.DataQualityError;
import com.questrail.opendrive.model.Include;
import com.questrail.opendrive.model.OpaqueElement;
import com.questrail.opendrive.model.PostProcessing;
import com.questrail.opendrive.model.RawData;
import com.questrail.opendrive.model.RawDataSource;
import com.questrail.opendrive.model.UserData;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects the {@code include} / {@code userData} / {@code dataQuality}
 * extension children of one element.
 */
final class AdditionalDataCollector
{
    private final List<Include> includes = new ArrayList<>();
    private final List<UserData> userData = new ArrayList<>();
    private DataQuality dataQuality;

    /**
     * @return true if {@code child} was an extension element and has been consumed
     */
    boolean accept(ElementReader child) {
        switch (child.name()) {
            case "include" -> {
                includes.add(new Include(child.requiredText("file")));
                return true;
            }
            case "userData" -> {
                userData.add(decodeUserData(child));
                return true;
            }
            case "dataQuality" -> {
                if (dataQuality != null) {
                    throw child.error(ErrorKind.STRUCTURAL_VIOLATION, null, null, "element may appear only once");
                }
                dataQuality = decodeDataQuality(child);
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    /**
     * Handles {@code child} as an extension element or skips it as unknown.
     */
    void acceptOrSkip(ElementReader child) {
        if (!accept(child)) {
            child.skipUnknown();
        }
    }

    AdditionalData build() {
        if (includes.isEmpty() && userData.isEmpty() && dataQuality == null) {
            return AdditionalData.EMPTY;
        }
        return new AdditionalData(includes, userData, Optional.ofNullable(dataQuality));
    }

    private static UserData decodeUserData(ElementReader element) {
        String code = element.requiredText("code");
        var value = element.optionalText("value");
        List<OpaqueElement> content = new ArrayList<>();
        element.forEachChild(child -> content.add(child.readOpaque()));
        return new UserData(code, value, content);
    }

    private static DataQuality decodeDataQuality(ElementReader element) {
        List<DataQualityError> error = new ArrayList<>(1);
        List<RawData> rawData = new ArrayList<>(1);
        element.forEachChild(child -> {
            switch (child.name()) {
                case "error" -> {
                    element.requireAbsent(error.isEmpty() ? null : error, "error");
                    error.add(new DataQualityError(
                            child.requiredLength("xyAbsolute"),
                            child.requiredLength("zAbsolute"),
                            child.requiredLength("xyRelative"),
                            child.requiredLength("zRelative")));
                }
                case "rawData" -> {
                    element.requireAbsent(rawData.isEmpty() ? null : rawData, "rawData");
                    rawData.add(new RawData(
                            child.requiredText("date"),
                            child.requiredEnum("source", RawDataSource.class),
                            child.optionalText("sourceComment"),
                            child.requiredEnum("postProcessing", PostProcessing.class),
                            child.optionalText("postProcessingComment")));
                }
                default -> child.skipUnknown();
            }
        });
        return new DataQuality(error.stream().findFirst(), rawData.stream().findFirst());
    }
}
