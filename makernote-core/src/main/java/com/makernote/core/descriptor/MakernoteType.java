package com.makernote.core.descriptor;

import com.makernote.core.descriptor.impl.apple.AppleMakernoteDescriptor;
import com.makernote.core.descriptor.impl.apple.AppleMakernoteTags;
import com.makernote.core.descriptor.impl.casio.CasioType1MakernoteDescriptor;
import com.makernote.core.descriptor.impl.casio.CasioType1MakernoteTags;
import com.makernote.core.descriptor.impl.casio.CasioType2MakernoteDescriptor;
import com.makernote.core.descriptor.impl.casio.CasioType2MakernoteTags;
import com.makernote.core.descriptor.impl.dji.DjiMakernoteDescriptor;
import com.makernote.core.descriptor.impl.dji.DjiMakernoteTags;
import com.makernote.core.descriptor.impl.kodak.KodakMakernoteDescriptor;
import com.makernote.core.descriptor.impl.kodak.KodakMakernoteTags;
import com.makernote.core.descriptor.impl.leica.LeicaMakernoteDescriptor;
import com.makernote.core.descriptor.impl.leica.LeicaMakernoteTags;
import com.makernote.core.descriptor.impl.leica.LeicaType5MakernoteDescriptor;
import com.makernote.core.descriptor.impl.leica.LeicaType5MakernoteTags;
import com.makernote.core.descriptor.impl.nikon.NikonPictureControl2Descriptor;
import com.makernote.core.descriptor.impl.nikon.NikonPictureControl2Tags;
import com.makernote.core.descriptor.impl.nikon.NikonType1MakernoteDescriptor;
import com.makernote.core.descriptor.impl.nikon.NikonType1MakernoteTags;
import com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteDescriptor;
import com.makernote.core.descriptor.impl.olympus.OlympusEquipmentMakernoteTags;
import com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteDescriptor;
import com.makernote.core.descriptor.impl.olympus.OlympusFocusInfoMakernoteTags;
import com.makernote.core.descriptor.impl.olympus.OlympusImageProcessingMakernoteDescriptor;
import com.makernote.core.descriptor.impl.olympus.OlympusImageProcessingMakernoteTags;
import com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopment2MakernoteDescriptor;
import com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopment2MakernoteTags;
import com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopmentMakernoteDescriptor;
import com.makernote.core.descriptor.impl.olympus.OlympusRawDevelopmentMakernoteTags;
import com.makernote.core.descriptor.impl.olympus.OlympusRawInfoMakernoteDescriptor;
import com.makernote.core.descriptor.impl.olympus.OlympusRawInfoMakernoteTags;
import com.makernote.core.descriptor.impl.pentax.PentaxMakernoteDescriptor;
import com.makernote.core.descriptor.impl.pentax.PentaxMakernoteTags;
import com.makernote.core.descriptor.impl.pentax.PentaxType2MakernoteDescriptor;
import com.makernote.core.descriptor.impl.pentax.PentaxType2MakernoteTags;
import com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFire2MakernoteDescriptor;
import com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFire2MakernoteTags;
import com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFire4KMakernoteDescriptor;
import com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFire4KMakernoteTags;
import com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteDescriptor;
import com.makernote.core.descriptor.impl.reconyx.ReconyxHyperFireMakernoteTags;
import com.makernote.core.descriptor.impl.reconyx.ReconyxUltraFireMakernoteDescriptor;
import com.makernote.core.descriptor.impl.reconyx.ReconyxUltraFireMakernoteTags;
import com.makernote.core.descriptor.impl.ricoh.RicohMakernoteDescriptor;
import com.makernote.core.descriptor.impl.ricoh.RicohMakernoteTags;
import com.makernote.core.descriptor.impl.samsung.SamsungType2MakernoteDescriptor;
import com.makernote.core.descriptor.impl.samsung.SamsungType2MakernoteTags;
import com.makernote.core.descriptor.impl.sanyo.SanyoMakernoteDescriptor;
import com.makernote.core.descriptor.impl.sanyo.SanyoMakernoteTags;
import com.makernote.core.descriptor.impl.sigma.SigmaMakernoteDescriptor;
import com.makernote.core.descriptor.impl.sigma.SigmaMakernoteTags;
import com.makernote.core.descriptor.impl.sony.SonyType6MakernoteDescriptor;
import com.makernote.core.descriptor.impl.sony.SonyType6MakernoteTags;
import com.makernote.core.tag.TagCatalog;
import com.makernote.core.tag.TagValues;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registry of the supported makernote layouts.
 *
 * <p>Each constant pairs a vendor's {@link TagCatalog} with its {@link TagDescriptor} under a
 * stable kebab-case id, which is what the command line and the configuration file refer to.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MakernoteType type = MakernoteType.fromId("kodak");
 * String name = type.nameOf(KodakMakernoteTags.TAG_FLASH_MODE).orElse("?");  // "Flash Mode"
 * Optional<String> text = type.describe(KodakMakernoteTags.TAG_FLASH_MODE, values);
 * }</pre>
 *
 * @since 1.0.0
 */
public enum MakernoteType {

    APPLE("apple", AppleMakernoteTags.CATALOG, new AppleMakernoteDescriptor()),
    CASIO_TYPE1("casio-type1", CasioType1MakernoteTags.CATALOG, new CasioType1MakernoteDescriptor()),
    CASIO_TYPE2("casio-type2", CasioType2MakernoteTags.CATALOG, new CasioType2MakernoteDescriptor()),
    DJI("dji", DjiMakernoteTags.CATALOG, new DjiMakernoteDescriptor()),
    KODAK("kodak", KodakMakernoteTags.CATALOG, new KodakMakernoteDescriptor()),
    LEICA("leica", LeicaMakernoteTags.CATALOG, new LeicaMakernoteDescriptor()),
    LEICA_TYPE5("leica-type5", LeicaType5MakernoteTags.CATALOG, new LeicaType5MakernoteDescriptor()),
    NIKON_TYPE1("nikon-type1", NikonType1MakernoteTags.CATALOG, new NikonType1MakernoteDescriptor()),
    NIKON_PICTURE_CONTROL2("nikon-picture-control2", NikonPictureControl2Tags.CATALOG,
        new NikonPictureControl2Descriptor()),
    OLYMPUS_EQUIPMENT("olympus-equipment", OlympusEquipmentMakernoteTags.CATALOG,
        new OlympusEquipmentMakernoteDescriptor()),
    OLYMPUS_FOCUS_INFO("olympus-focus-info", OlympusFocusInfoMakernoteTags.CATALOG,
        new OlympusFocusInfoMakernoteDescriptor()),
    OLYMPUS_IMAGE_PROCESSING("olympus-image-processing", OlympusImageProcessingMakernoteTags.CATALOG,
        new OlympusImageProcessingMakernoteDescriptor()),
    OLYMPUS_RAW_DEVELOPMENT("olympus-raw-development", OlympusRawDevelopmentMakernoteTags.CATALOG,
        new OlympusRawDevelopmentMakernoteDescriptor()),
    OLYMPUS_RAW_DEVELOPMENT2("olympus-raw-development2", OlympusRawDevelopment2MakernoteTags.CATALOG,
        new OlympusRawDevelopment2MakernoteDescriptor()),
    OLYMPUS_RAW_INFO("olympus-raw-info", OlympusRawInfoMakernoteTags.CATALOG, new OlympusRawInfoMakernoteDescriptor()),
    PENTAX("pentax", PentaxMakernoteTags.CATALOG, new PentaxMakernoteDescriptor()),
    PENTAX_TYPE2("pentax-type2", PentaxType2MakernoteTags.CATALOG, new PentaxType2MakernoteDescriptor()),
    RECONYX_HYPERFIRE("reconyx-hyperfire", ReconyxHyperFireMakernoteTags.CATALOG,
        new ReconyxHyperFireMakernoteDescriptor()),
    RECONYX_HYPERFIRE2("reconyx-hyperfire2", ReconyxHyperFire2MakernoteTags.CATALOG,
        new ReconyxHyperFire2MakernoteDescriptor()),
    RECONYX_HYPERFIRE4K("reconyx-hyperfire4k", ReconyxHyperFire4KMakernoteTags.CATALOG,
        new ReconyxHyperFire4KMakernoteDescriptor()),
    RECONYX_ULTRAFIRE("reconyx-ultrafire", ReconyxUltraFireMakernoteTags.CATALOG,
        new ReconyxUltraFireMakernoteDescriptor()),
    RICOH("ricoh", RicohMakernoteTags.CATALOG, new RicohMakernoteDescriptor()),
    SAMSUNG_TYPE2("samsung-type2", SamsungType2MakernoteTags.CATALOG, new SamsungType2MakernoteDescriptor()),
    SANYO("sanyo", SanyoMakernoteTags.CATALOG, new SanyoMakernoteDescriptor()),
    SIGMA("sigma", SigmaMakernoteTags.CATALOG, new SigmaMakernoteDescriptor()),
    SONY_TYPE6("sony-type6", SonyType6MakernoteTags.CATALOG, new SonyType6MakernoteDescriptor());

    private final String id;
    private final TagCatalog catalog;
    private final TagDescriptor descriptor;

    MakernoteType(String id, TagCatalog catalog, TagDescriptor descriptor) {
        this.id = id;
        this.catalog = catalog;
        this.descriptor = descriptor;
    }

    /**
     * Returns the stable identifier, for example {@code "olympus-equipment"}.
     *
     * @return kebab-case id
     */
    public String getId() {
        return id;
    }

    public TagCatalog getCatalog() {
        return catalog;
    }

    public TagDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Returns the directory display name, such as {@code "Olympus Equipment"}.
     *
     * @return vendor name from the catalog
     */
    public String getVendorName() {
        return catalog.vendorName();
    }

    public Optional<String> nameOf(int tagId) {
        return catalog.nameOf(tagId);
    }

    public Optional<String> describe(int tagId, TagValues values) {
        Objects.requireNonNull(values, "values must not be null");
        return descriptor.describe(tagId, values);
    }

    /**
     * Looks up a type by its id, ignoring case.
     *
     * @param id kebab-case id
     * @return matching type, or empty
     */
    public static Optional<MakernoteType> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.id.equals(normalized))
            .findFirst();
    }

    /**
     * Looks up a type by its id, ignoring case.
     *
     * @param id kebab-case id
     * @return matching type
     * @throws IllegalArgumentException if no type has this id
     */
    public static MakernoteType fromId(String id) {
        return findById(id).orElseThrow(() -> new IllegalArgumentException(
            "Unknown makernote type '" + id + "'. Known types: " + knownIds()));
    }

    private static String knownIds() {
        return Arrays.stream(values())
            .map(MakernoteType::getId)
            .collect(Collectors.joining(", "));
    }
}
