package com.makernote.core.descriptor.impl.ricoh;

import com.makernote.core.descriptor.base.AbstractTagDescriptor;

/**
 * Descriptions for the Ricoh makernote. No tag has a vendor specific rendering yet, so
 * every value takes the default description.
 */
public final class RicohMakernoteDescriptor extends AbstractTagDescriptor {
}
