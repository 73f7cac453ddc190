package de.t14d3.folio.mapping;

import de.t14d3.folio.annotations.CascadeType;
import de.t14d3.folio.annotations.ChangeTracking;
import de.t14d3.folio.annotations.Document;
import de.t14d3.folio.annotations.EmbedMany;
import de.t14d3.folio.annotations.EmbedOne;
import de.t14d3.folio.annotations.EmbeddedDocument;
import de.t14d3.folio.annotations.Id;
import de.t14d3.folio.annotations.LifecycleCallback;
import de.t14d3.folio.annotations.Property;
import de.t14d3.folio.annotations.ReferenceMany;
import de.t14d3.folio.annotations.ReferenceOne;
import de.t14d3.folio.event.LifecycleEvent;
import de.t14d3.folio.exceptions.FolioException;
import de.t14d3.folio.exceptions.MappingException;

import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;

/**
 * Builds a {@link ClassDescription} from the mapping annotations of a class.
 * Reflection happens here, once per class; the resulting description only holds
 * pre-resolved accessors.
 */
public class AnnotationDescriptionReader {

    public ClassDescription read(Class<?> type) {
        return describe(type);
    }

    private <T> ClassDescription describe(Class<T> type) {
        boolean document = type.isAnnotationPresent(Document.class);
        boolean embedded = type.isAnnotationPresent(EmbeddedDocument.class);
        if (!document && !embedded) {
            throw MappingException.notADocument(type);
        }

        ClassDescription.Builder<T> builder = ClassDescription.builder(type);
        if (embedded) {
            builder.embedded();
        } else {
            Class<?> root = findRootType(type);
            builder.root(root);
            String collection = root.getAnnotation(Document.class).collection();
            if (!collection.isEmpty()) {
                builder.collection(collection);
            }
        }

        ChangeTracking changeTracking = findAnnotation(type, ChangeTracking.class);
        if (changeTracking != null) {
            builder.changeTracking(changeTracking.value());
        }

        for (Class<?> current : hierarchy(type)) {
            for (Field field : current.getDeclaredFields()) {
                if (field.isSynthetic() || Modifier.isStatic(field.getModifiers())
                        || Modifier.isTransient(field.getModifiers())) {
                    continue;
                }
                readField(type, builder, field);
            }
            for (Method method : current.getDeclaredMethods()) {
                LifecycleCallback callback = method.getAnnotation(LifecycleCallback.class);
                if (callback != null) {
                    registerCallback(type, builder, method, callback);
                }
            }
        }

        Constructor<T> constructor = findDefaultConstructor(type);
        if (constructor != null) {
            builder.instantiator(() -> instantiate(type, constructor));
        }
        return builder.build();
    }

    private void readField(Class<?> type, ClassDescription.Builder<?> builder, Field field) {
        if (field.isAnnotationPresent(Id.class)) {
            FieldMapping id = new FieldMapping(field.getName(), "_id", FieldMapping.Kind.SCALAR, field.getType(),
                    null, false, false, new ReflectiveFieldAccessor(field));
            builder.identifierMapping(id, field.getAnnotation(Id.class).generated());
            return;
        }

        ReflectiveFieldAccessor accessor;
        if (field.isAnnotationPresent(Property.class)) {
            accessor = new ReflectiveFieldAccessor(field);
            String stored = field.getAnnotation(Property.class).name();
            builder.mapping(new FieldMapping(field.getName(), stored, FieldMapping.Kind.SCALAR, null,
                    null, true, false, accessor));
        } else if (field.isAnnotationPresent(ReferenceOne.class)) {
            ReferenceOne ref = field.getAnnotation(ReferenceOne.class);
            accessor = new ReflectiveFieldAccessor(field);
            builder.mapping(new FieldMapping(field.getName(), field.getName(), FieldMapping.Kind.REF_ONE,
                    target(ref.targetDocument(), field), cascade(ref.cascade()), ref.nullable(), ref.orphanRemoval(),
                    accessor));
        } else if (field.isAnnotationPresent(ReferenceMany.class)) {
            ReferenceMany ref = field.getAnnotation(ReferenceMany.class);
            requireList(type, field);
            accessor = new ReflectiveFieldAccessor(field);
            builder.mapping(FieldMapping.association(field.getName(), FieldMapping.Kind.REF_MANY,
                    ref.targetDocument(), Arrays.asList(ref.cascade()), accessor));
        } else if (field.isAnnotationPresent(EmbedOne.class)) {
            EmbedOne embed = field.getAnnotation(EmbedOne.class);
            accessor = new ReflectiveFieldAccessor(field);
            builder.mapping(FieldMapping.association(field.getName(), FieldMapping.Kind.EMBED_ONE,
                    target(embed.targetDocument(), field), null, accessor));
        } else if (field.isAnnotationPresent(EmbedMany.class)) {
            EmbedMany embed = field.getAnnotation(EmbedMany.class);
            requireList(type, field);
            accessor = new ReflectiveFieldAccessor(field);
            builder.mapping(FieldMapping.association(field.getName(), FieldMapping.Kind.EMBED_MANY,
                    embed.targetDocument(), null, accessor));
        }
        // fields without a mapping annotation are not persistent
    }

    private void registerCallback(Class<?> type, ClassDescription.Builder<?> builder, Method method,
                                  LifecycleCallback callback) {
        if (method.getParameterCount() != 0) {
            throw new MappingException("Lifecycle callback " + type.getName() + "#" + method.getName()
                    + " must not take parameters");
        }
        method.setAccessible(true);
        for (LifecycleEvent event : callback.value()) {
            if (event == LifecycleEvent.ON_FLUSH) {
                continue;
            }
            builder.callback(event, document -> invokeCallback(method, document));
        }
    }

    private static void invokeCallback(Method method, Object document) {
        try {
            method.invoke(document);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new FolioException("Lifecycle callback " + method.getName() + " failed", e.getCause());
        } catch (IllegalAccessException e) {
            throw new MappingException("Cannot invoke lifecycle callback " + method.getName(), e);
        }
    }

    private static Class<?> findRootType(Class<?> type) {
        Class<?> root = type;
        for (Class<?> current = type.getSuperclass(); current != null && current != Object.class;
             current = current.getSuperclass()) {
            if (current.isAnnotationPresent(Document.class)) {
                root = current;
            }
        }
        return root;
    }

    /**
     * The class and its superclasses, topmost first, so inherited fields come first.
     */
    private static List<Class<?>> hierarchy(Class<?> type) {
        Deque<Class<?>> classes = new ArrayDeque<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            classes.addFirst(current);
        }
        return new ArrayList<>(classes);
    }

    private static <A extends Annotation> A findAnnotation(Class<?> type, Class<A> annotation) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            A found = current.getAnnotation(annotation);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static Class<?> target(Class<?> declared, Field field) {
        return declared == void.class ? field.getType() : declared;
    }

    private static EnumSet<CascadeType> cascade(CascadeType[] types) {
        EnumSet<CascadeType> set = EnumSet.noneOf(CascadeType.class);
        set.addAll(Arrays.asList(types));
        return set;
    }

    private static void requireList(Class<?> type, Field field) {
        if (!List.class.isAssignableFrom(field.getType())) {
            throw new MappingException("Collection field '" + field.getName() + "' in " + type.getName()
                    + " must be declared as java.util.List");
        }
    }

    private static <T> Constructor<T> findDefaultConstructor(Class<T> type) {
        if (Modifier.isAbstract(type.getModifiers())) {
            return null;
        }
        try {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static <T> T instantiate(Class<T> type, Constructor<T> constructor) {
        try {
            return constructor.newInstance();
        } catch (InvocationTargetException | InstantiationException | IllegalAccessException e) {
            throw new MappingException("Cannot instantiate document " + type.getName(), e);
        }
    }
}
