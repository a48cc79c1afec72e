package com.makernote.core.descriptor.impl.pentax;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;

/**
 * Descriptions for the later Pentax makernote. Values take the default description;
 * {@link PentaxType2MakernoteTags} supplies the names.
 */
public final class PentaxType2MakernoteDescriptor extends AbstractTagDescriptor {
}
