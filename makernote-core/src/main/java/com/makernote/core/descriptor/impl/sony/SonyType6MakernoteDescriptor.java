package com.makernote.core.descriptor.impl.sony;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;
import com.makernote.core.tag.TagValues;

import java.util.Optional;

import static com.makernote.core.descriptor.impl.sony.SonyType6MakernoteTags.*;

/**
 * Descriptions for the Sony Type 6 makernote.
 */
public final class SonyType6MakernoteDescriptor extends AbstractTagDescriptor {

    @Override
    public Optional<String> describe(int tagId, TagValues values) {
        if (tagId == TAG_MAKERNOTE_THUMB_VERSION) {
            return versionBytes(values, tagId, 2);
        }
        return super.describe(tagId, values);
    }
}
