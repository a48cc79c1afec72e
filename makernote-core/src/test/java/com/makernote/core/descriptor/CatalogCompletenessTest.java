package com.makernote.core.descriptor;

import com.makernote.core.tag.TagCatalog;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks every vendor's {@code TAG_} constants against its published catalog.
 *
 * <p>The constant holder is found by naming convention: {@code FooDescriptor} pairs with
 * {@code FooTags} in the same package.
 */
class CatalogCompletenessTest {

    @ParameterizedTest
    @EnumSource(MakernoteType.class)
    void catalog_namesEveryTagConstant(MakernoteType type) throws Exception {
        Class<?> tags = tagsClassOf(type);
        List<Integer> constants = tagConstants(tags);

        assertThat(constants).isNotEmpty();
        assertThat(constants).allMatch(type.getCatalog()::contains);
        assertThat(constants).doesNotHaveDuplicates();
        assertThat(type.getCatalog().size()).isEqualTo(constants.size());
    }

    @ParameterizedTest
    @EnumSource(MakernoteType.class)
    void registeredCatalog_isTheVendorsPublishedCatalog(MakernoteType type) throws Exception {
        Object published = tagsClassOf(type).getField("CATALOG").get(null);

        assertThat(published).isInstanceOf(TagCatalog.class).isSameAs(type.getCatalog());
    }

    private static Class<?> tagsClassOf(MakernoteType type) throws ClassNotFoundException {
        String descriptorName = type.getDescriptor().getClass().getName();
        return Class.forName(descriptorName.replaceFirst("Descriptor$", "Tags"));
    }

    private static List<Integer> tagConstants(Class<?> tags) throws IllegalAccessException {
        List<Integer> ids = new ArrayList<>();
        for (Field field : tags.getFields()) {
            if (field.getName().startsWith("TAG_")
                && field.getType() == int.class
                && Modifier.isStatic(field.getModifiers())) {
                ids.add(field.getInt(null));
            }
        }
        return ids;
    }
}
