package com.makernote.cli;

import com.makernote.core.descriptor.MakernoteType;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Converts a vendor id argument such as {@code olympus-equipment} into its
 * {@link MakernoteType}. Unknown ids become picocli usage errors.
 */
public class MakernoteTypeConverter implements ITypeConverter<MakernoteType> {

    @Override
    public MakernoteType convert(String value) {
        try {
            return MakernoteType.fromId(value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }
}
