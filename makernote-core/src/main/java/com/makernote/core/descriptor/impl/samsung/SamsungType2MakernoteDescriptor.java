package com.makernote.core.descriptor.impl.samsung;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.descriptor.base.DescriptionRules;
import com.makernote.core.tag.TagValues;

import java.util.Map;
import java.util.Optional;

import static com.makernote.core.descriptor.impl.samsung.SamsungType2MakernoteTags.*;

/**
 * Descriptions for the Samsung Type 2 makernote.
 */
public final class SamsungType2MakernoteDescriptor extends AbstractTagDescriptor {

    // Some ids were reused across models; the later model wins
    private static final Map<Long, String> MODELS = Map.ofEntries(
        Map.entry(0x100101cL, "NX10"),
        Map.entry(0x1001226L, "HMX-S15BP"),
        Map.entry(0x1001233L, "HMX-Q10"),
        Map.entry(0x1001234L, "HMX-H304"),
        Map.entry(0x100130cL, "NX100"),
        Map.entry(0x1001327L, "NX11"),
        Map.entry(0x170104eL, "ES70, ES71 / VLUU ES70, ES71 / SL600"),
        Map.entry(0x1701052L, "ES73 / VLUU ES73 / SL605"),
        Map.entry(0x1701300L, "ES28 / VLUU ES28"),
        Map.entry(0x1701303L, "ES74,ES75,ES78 / VLUU ES75,ES78"),
        Map.entry(0x2001046L, "PL150 / VLUU PL150 / TL210 / PL151"),
        Map.entry(0x2001311L, "PL120,PL121 / VLUU PL120,PL121"),
        Map.entry(0x2001315L, "PL170,PL171 / VLUUPL170,PL171"),
        Map.entry(0x200131eL, "PL210, PL211 / VLUU PL210, PL211"),
        Map.entry(0x2701317L, "PL20,PL21 / VLUU PL20,PL21"),
        Map.entry(0x2a0001bL, "WP10 / VLUU WP10 / AQ100"),
        Map.entry(0x3000000L, "Various Models (0x3000000)"),
        Map.entry(0x3a00018L, "Various Models (0x3a00018)"),
        Map.entry(0x400101fL, "ST1000 / ST1100 / VLUU ST1000 / CL65"),
        Map.entry(0x4001022L, "ST550 / VLUU ST550 / TL225"),
        Map.entry(0x4001025L, "Various Models (0x4001025)"),
        Map.entry(0x400103eL, "VLUU ST5500, ST5500, CL80"),
        Map.entry(0x4001041L, "VLUU ST5000, ST5000, TL240"),
        Map.entry(0x4001043L, "ST70 / VLUU ST70 / ST71"),
        Map.entry(0x400130aL, "Various Models (0x400130a)"),
        Map.entry(0x400130eL, "ST90,ST91 / VLUU ST90,ST91"),
        Map.entry(0x4001313L, "VLUU ST95, ST95"),
        Map.entry(0x4a00015L, "VLUU ST60"),
        Map.entry(0x4a0135bL, "ST30, ST65 / VLUU ST65 / ST67"),
        Map.entry(0x5000000L, "Various Models (0x5000000)"),
        Map.entry(0x5001038L, "Various Models (0x5001038)"),
        Map.entry(0x500103aL, "WB650 / VLUU WB650 / WB660"),
        Map.entry(0x500103cL, "WB600 / VLUU WB600 / WB610"),
        Map.entry(0x500133eL, "WB150 / WB150F / WB152 / WB152F / WB151"),
        Map.entry(0x5a0000fL, "WB5000 / HZ25W"),
        Map.entry(0x6001036L, "EX1"),
        Map.entry(0x700131cL, "VLUU SH100, SH100"),
        Map.entry(0x27127002L, "SMX - C20N")
    );

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        return switch (tagId) {
            case TAG_MAKER_NOTE_VERSION -> versionBytes(values, tagId, 2);
            case TAG_DEVICE_TYPE -> unsignedLong(values, tagId).map(SamsungType2MakernoteDescriptor::deviceType);
            case TAG_SAMSUNG_MODEL_ID -> unsignedLong(values, tagId).map(SamsungType2MakernoteDescriptor::model);
            case TAG_CAMERA_TEMPERATURE -> formattedInt(values, tagId, "%d C");
            case TAG_FACE_DETECT, TAG_FACE_RECOGNITION -> indexed(values, tagId, "Off", "On");
            default -> super.describe(tagId, values);
        };
    }

    static String deviceType(long value) {
        if (value == 0x1000) {
            return "Compact Digital Camera";
        } else if (value == 0x2000) {
            return "High-end NX Camera";
        } else if (value == 0x3000) {
            return "HXM Video Camera";
        } else if (value == 0x12000) {
            return "Cell Phone";
        } else if (value == 0x300000) {
            return "SMX Video Camera";
        }
        return DescriptionRules.unknown(value);
    }

    static String model(long value) {
        String model = MODELS.get(value);
        return model != null ? model : DescriptionRules.unknown(value);
    }

    private static Optional<Long> unsignedLong(TagValues values, int tagId) {
        return values.getLong(tagId).stream().mapToObj(value -> value & 0xFFFFFFFFL).findFirst();
    }
}
