/*
 * The MIT License
 *
 * Copyright 2022 Mastfrog Technologies.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package com.mastfrog.boundednumber.processor;

import com.mastfrog.annotation.AnnotationUtils;
import static com.mastfrog.boundednumber.processor.BoundedNumberAnnotationProcessor.BOUNDED_NUMBER_ANNO;
import static com.mastfrog.boundednumber.processor.NumericType.FLOAT;
import static com.mastfrog.boundednumber.processor.NumericType.LONG;
import static com.mastfrog.boundednumber.processor.NumericType.UNSIGNED_LONG;
import com.mastfrog.java.vogon.ClassBuilder;
import com.mastfrog.util.service.ServiceProvider;
import com.mastfrog.util.strings.Strings;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Serializable;
import java.math.BigDecimal;
import static java.nio.charset.StandardCharsets.UTF_8;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.DoubleSupplier;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;
import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Filer;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import static javax.lang.model.element.Modifier.ABSTRACT;
import static javax.lang.model.element.Modifier.FINAL;
import static javax.lang.model.element.Modifier.PRIVATE;
import static javax.lang.model.element.Modifier.PUBLIC;
import static javax.lang.model.element.Modifier.STATIC;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;
import javax.tools.JavaFileObject;

/**
 * Generates a clamping value class for each interface annotated with
 * BoundedNumber, failing the compilation if the bounds cannot be represented
 * by the interface's storage type.
 *
 * @author Tim Boudreau
 */
@ServiceProvider(Processor.class)
@SupportedAnnotationTypes(BOUNDED_NUMBER_ANNO)
@SupportedSourceVersion(SourceVersion.RELEASE_17)
public class BoundedNumberAnnotationProcessor extends AbstractProcessor {

    private static final long SER_VERSION = 1;
    private AnnotationUtils utils;
    private final Map<TypeElement, BoundsModel> models = new LinkedHashMap<>();

    private static final String PKG = "com.mastfrog.boundednumber";

    static final String BOUNDED_NUMBER_ANNO = PKG + ".BoundedNumber";
    private static final String BOUNDED_VALUE_TYPE = PKG + ".BoundedValue";
    private static final String CLAMPING_TYPE = PKG + ".Clamping";

    /**
     * Prefix prepended to the interface name to name the generated class.
     */
    public static final String GENERATED_PREFIX = "Bounded";

    // Members every generated class has, which an accessor or literal
    // factory may not reuse
    static final Set<String> RESERVED_NAMES = Collections.unmodifiableSet(new TreeSet<>(Arrays.asList(
            "number", "minimum", "maximum", "storageType", "isAtMinimum", "isAtMaximum",
            "getAsInt", "getAsLong", "getAsDouble", "set", "setUnsigned", "ofUnsigned",
            "copy", "compareTo", "equals", "hashCode", "toString", "readResolve",
            "getClass", "notify", "notifyAll", "wait", "clone", "finalize")));

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        utils = new AnnotationUtils(processingEnv, getSupportedAnnotationTypes(), BoundedNumberAnnotationProcessor.class);
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        utils.findAnnotatedElements(roundEnv, getSupportedAnnotationTypes())
                .forEach(item -> {
                    AnnotationMirror anno = utils.findAnnotationMirror(item, BOUNDED_NUMBER_ANNO);
                    handleItem(item, anno);
                });
        try {
            for (Map.Entry<TypeElement, BoundsModel> e : models.entrySet()) {
                ClassBuilder<String> cb = e.getValue().generator().sortMembers();
                Filer filer = utils.processingEnv().getFiler();
                try {
                    JavaFileObject src = filer.createSourceFile(cb.fqn(), e.getKey());
                    try ( OutputStream out = src.openOutputStream()) {
                        out.write(cb.build().getBytes(UTF_8));
                    }
                } catch (IOException ex) {
                    utils.fail("Could not write " + cb.fqn() + ": " + ex, e.getKey());
                }
            }
        } finally {
            models.clear();
        }
        return true;
    }

    private void handleItem(Element item, AnnotationMirror anno) {
        if (item.getKind() != ElementKind.INTERFACE) {
            utils.fail("@BoundedNumber can only be applied to an interface, not a "
                    + item.getKind() + ": " + item, item, anno);
            return;
        }
        TypeElement type = (TypeElement) item;
        if (type.getModifiers().contains(PRIVATE)) {
            utils.fail("@BoundedNumber interfaces cannot be private", type, anno);
            return;
        }
        if (!type.getTypeParameters().isEmpty()) {
            utils.fail("@BoundedNumber interfaces cannot have type parameters", type, anno);
            return;
        }
        ExecutableElement accessor = findAccessor(type, anno);
        if (accessor == null) {
            return;
        }
        Optional<NumericType> storage = NumericType.forKind(accessor.getReturnType().getKind());
        if (!storage.isPresent()) {
            utils.fail("The accessor " + accessor.getSimpleName() + "() returns "
                    + accessor.getReturnType() + ", which cannot store a bounded number. Use one of "
                    + Strings.join(", ", storageTypeNames()),
                    type.equals(accessor.getEnclosingElement()) ? accessor : type, anno);
            return;
        }
        String minText = utils.annotationValue(anno, "minimum", String.class, "");
        String maxText = utils.annotationValue(anno, "maximum", String.class, "");
        String literal = utils.annotationValue(anno, "literal", String.class, "").trim();

        BoundLiteral min = parseBound("minimum", minText, type, anno);
        BoundLiteral max = parseBound("maximum", maxText, type, anno);
        if (min == null || max == null) {
            return;
        }
        if (!validateBounds(storage.get(), min, max, type, anno)) {
            return;
        }
        if (!literal.isEmpty() && !validateLiteralName(literal, accessor, type, anno)) {
            return;
        }
        models.put(type, new BoundsModel(type, anno, accessor, storage.get(),
                storage.get().round(min.value()), storage.get().round(max.value()), literal));
    }

    private ExecutableElement findAccessor(TypeElement type, AnnotationMirror anno) {
        // Inherited abstract methods must be implemented by the generated class too
        List<ExecutableElement> candidates = new ArrayList<>();
        Elements elements = utils.processingEnv().getElementUtils();
        for (ExecutableElement method : ElementFilter.methodsIn(elements.getAllMembers(type))) {
            Set<Modifier> mods = method.getModifiers();
            if (mods.contains(ABSTRACT) && !mods.contains(STATIC)) {
                candidates.add(method);
            }
        }
        if (candidates.size() != 1) {
            List<String> names = new ArrayList<>();
            for (ExecutableElement c : candidates) {
                names.add(c.getEnclosingElement().getSimpleName() + "." + c.getSimpleName() + "()");
            }
            utils.fail("@BoundedNumber interfaces must have exactly one abstract method, "
                    + "declared or inherited, whose return type is the storage type, but "
                    + type.getSimpleName() + " has " + candidates.size()
                    + (names.isEmpty() ? "" : ": " + Strings.join(", ", names)), type, anno);
            return null;
        }
        ExecutableElement result = candidates.get(0);
        // Report on the interface if the accessor lives in a supertype
        Element target = type.equals(result.getEnclosingElement()) ? result : type;
        if (!result.getParameters().isEmpty() || !result.getTypeParameters().isEmpty()) {
            utils.fail("The accessor " + result.getSimpleName() + " of a @BoundedNumber "
                    + "interface may not take arguments or type parameters", target, anno);
            return null;
        }
        if (RESERVED_NAMES.contains(result.getSimpleName().toString())) {
            utils.fail("The accessor name " + result.getSimpleName() + " clashes with a member "
                    + "of the generated class. Reserved: " + Strings.join(", ", RESERVED_NAMES),
                    target, anno);
            return null;
        }
        return result;
    }

    private BoundLiteral parseBound(String attribute, String text, TypeElement type, AnnotationMirror anno) {
        try {
            return BoundLiteral.parse(text);
        } catch (NumberFormatException ex) {
            utils.fail("Bad " + attribute + " '" + text + "': " + ex.getMessage(), type, anno);
            return null;
        }
    }

    private boolean validateBounds(NumericType storage, BoundLiteral min, BoundLiteral max,
            TypeElement type, AnnotationMirror anno) {
        if (storage.canRepresentBounds(min, max)) {
            return true;
        }
        if (!storage.canHold(min.value(), min.isFloatingPoint())) {
            utils.fail(describeUnholdable("Minimum", min, storage), type, anno);
        }
        if (!storage.canHold(max.value(), max.isFloatingPoint())) {
            utils.fail(describeUnholdable("Maximum", max, storage), type, anno);
        }
        if (min.value().compareTo(max.value()) > 0) {
            utils.fail("Minimum and maximum are contradictory: " + min
                    + " > " + max, type, anno);
        }
        return false;
    }

    private static String describeUnholdable(String what, BoundLiteral bound, NumericType storage) {
        if (!storage.inRange(bound.value())) {
            return what + " " + bound + " is outside the range of " + storage + ", "
                    + storage.display(storage.lowest()) + " to " + storage.display(storage.highest());
        }
        if (storage.isIntegral()) {
            return what + " " + bound + " has a fractional part, which " + storage + " cannot hold";
        }
        return what + " " + bound + " cannot be represented exactly as a " + storage
                + "; write it as a floating point literal to accept the nearest " + storage;
    }

    private boolean validateLiteralName(String literal, ExecutableElement accessor,
            TypeElement type, AnnotationMirror anno) {
        if (!SourceVersion.isIdentifier(literal) || SourceVersion.isKeyword(literal)) {
            utils.fail("Literal factory name '" + literal + "' is not a legal Java identifier", type, anno);
            return false;
        }
        if (RESERVED_NAMES.contains(literal) || literal.contentEquals(accessor.getSimpleName())) {
            utils.fail("Literal factory name '" + literal + "' clashes with a member of "
                    + "the generated class", type, anno);
            return false;
        }
        return true;
    }

    private static List<String> storageTypeNames() {
        List<String> result = new ArrayList<>();
        for (NumericType t : NumericType.values()) {
            if (t.isStorable()) {
                result.add(t.javaName());
            }
        }
        return result;
    }

    /**
     * Generates one constructor and one set method for a type of value a
     * bounded number may be assigned from.
     */
    final class InputElement {

        final NumericType input;
        final BoundsModel model;

        InputElement(NumericType input, BoundsModel model) {
            this.input = input;
            this.model = model;
        }

        /**
         * If the input type can hold both bounds exactly, clamp in its domain
         * and then narrow, so a huge value is never truncated into the
         * storage type before it is clamped; otherwise convert to the storage
         * type and clamp there.
         */
        boolean clampsBeforeConverting() {
            if (!input.representsBounds(model.minimum, model.maximum)) {
                return false;
            }
            // Bounds are cast to a signed long in the generated code
            return input != UNSIGNED_LONG || LONG.represents(model.maximum);
        }

        String clampExpression(String varName) {
            NumericType storage = model.storage;
            if (input == UNSIGNED_LONG) {
                return unsignedClampExpression(varName);
            }
            if (clampsBeforeConverting()) {
                String domain = input.clampDomain();
                String clamped = "Clamping.clamp(" + varName + ", "
                        + boundIn(domain, "MINIMUM") + ", " + boundIn(domain, "MAXIMUM") + ")";
                return narrowTo(storage, domain, clamped);
            }
            String domain = storage.clampDomain();
            String converted = input.clampDomain().equals(domain)
                    ? varName : "(" + domain + ") " + varName;
            return narrowTo(storage, domain, "Clamping.clamp(" + converted + ", MINIMUM, MAXIMUM)");
        }

        private String unsignedClampExpression(String varName) {
            NumericType storage = model.storage;
            if (clampsBeforeConverting()) {
                return narrowTo(storage, "long", "Clamping.clampUnsigned(" + varName
                        + ", " + boundIn("long", "MINIMUM") + ", " + boundIn("long", "MAXIMUM") + ")");
            }
            if (storage.isIntegral()) {
                // Values at or above 2^63 exceed every integral maximum
                return varName + " < 0 ? MAXIMUM : "
                        + new InputElement(LONG, model).clampExpression(varName);
            }
            String converted = storage == FLOAT
                    ? "Clamping.unsignedToFloat(" + varName + ")"
                    : "Clamping.unsignedToDouble(" + varName + ")";
            return "Clamping.clamp(" + converted + ", MINIMUM, MAXIMUM)";
        }

        private String boundIn(String domain, String constant) {
            if (model.storage.clampDomain().equals(domain)) {
                return constant;
            }
            return "(" + domain + ") " + constant;
        }

        private String narrowTo(NumericType storage, String domain, String expression) {
            if (storage.isAssignableFrom(domain)) {
                return expression;
            }
            return "(" + storage.javaName() + ") " + expression;
        }

        String describe() {
            if (input == UNSIGNED_LONG) {
                return "unsigned 64-bit value";
            }
            return input.javaName();
        }

        void generateConstructor(ClassBuilder<String> cb) {
            cb.constructor(con -> {
                con.docComment("Create a new " + cb.className() + " from a " + describe()
                        + ", clamped into [" + model.displayMinimum() + ", " + model.displayMaximum() + "]."
                        + "\n@param value a value");
                con.setModifier(PUBLIC)
                        .addArgument(input.javaName(), "value")
                        .body(bb -> {
                            bb.invoke("set").withArgument("value").inScope();
                        });
            });
        }

        void generateSetMethod(ClassBuilder<String> cb) {
            String name = input == UNSIGNED_LONG ? "setUnsigned" : "set";
            String dox = "Set the value from a " + describe() + ", clamping it to "
                    + model.displayMinimum() + " if less, or " + model.displayMaximum()
                    + " if greater" + (input.isFloatingPoint() ? " (NaN is treated as less)" : "")
                    + (clampsBeforeConverting() && input != model.storage
                    ? ". The value is clamped as a " + describe()
                    + " before it is converted to " + model.storage + "."
                    : ".")
                    + "\n@param value a value"
                    + "\n@return this";
            cb.method(name, mth -> {
                mth.withModifier(PUBLIC)
                        .addArgument(input.javaName(), "value")
                        .docComment(dox)
                        .returning(cb.className())
                        .body(bb -> {
                            bb.statement("this.value = " + clampExpression("value"));
                            bb.returning("this");
                        });
            });
        }

        @Override
        public String toString() {
            return "InputElement{" + input + " -> " + model.storage
                    + (clampsBeforeConverting() ? " clamp-then-convert" : " convert-then-clamp") + '}';
        }
    }

    final class BoundsModel {

        private final TypeElement el;
        private final AnnotationMirror on;
        private final ExecutableElement accessor;
        final NumericType storage;
        final BigDecimal minimum;
        final BigDecimal maximum;
        private final String literal;

        BoundsModel(TypeElement el, AnnotationMirror on, ExecutableElement accessor,
                NumericType storage, BigDecimal minimum, BigDecimal maximum, String literal) {
            this.el = el;
            this.on = on;
            this.accessor = accessor;
            this.storage = storage;
            this.minimum = minimum;
            this.maximum = maximum;
            this.literal = literal;
        }

        String displayMinimum() {
            return storage.display(minimum);
        }

        String displayMaximum() {
            return storage.display(maximum);
        }

        String generatedClassName() {
            return GENERATED_PREFIX + el.getSimpleName();
        }

        List<InputElement> toElements() {
            List<InputElement> result = new ArrayList<>();
            for (NumericType input : storage.acceptedInputs()) {
                result.add(new InputElement(input, this));
            }
            return result;
        }

        private long serialVersionUid() {
            long val = SER_VERSION;
            for (String s : new String[]{storage.javaName(), displayMinimum(), displayMaximum()}) {
                val = (28687 * val) ^ s.hashCode();
            }
            return val;
        }

        private String supplierType() {
            switch (storage) {
                case LONG:
                    return "LongSupplier";
                case FLOAT:
                case DOUBLE:
                    return "DoubleSupplier";
                default:
                    return "IntSupplier";
            }
        }

        private String supplierMethod() {
            switch (storage) {
                case LONG:
                    return "getAsLong";
                case FLOAT:
                case DOUBLE:
                    return "getAsDouble";
                default:
                    return "getAsInt";
            }
        }

        private String equalityTest(String other) {
            if (storage.isFloatingPoint()) {
                return storage.boxedName() + ".compare(" + other + ", value) == 0";
            }
            return other + " == value";
        }

        ClassBuilder<String> generator() {
            String className = generatedClassName();
            String valueType = storage.javaName();
            String boxed = storage.boxedName();
            String ifaceName = el.getSimpleName().toString();

            ClassBuilder<String> result = ClassBuilder.forPackage(utils.packageName(el))
                    .named(className)
                    .importing(Serializable.class)
                    .importing(BOUNDED_VALUE_TYPE)
                    .importing(CLAMPING_TYPE)
                    .withModifier(PUBLIC, FINAL)
                    .implementing(ifaceName)
                    .implementing("BoundedValue<" + boxed + ">")
                    .implementing("Comparable<" + className + ">")
                    .implementing("Serializable")
                    .docComment("A " + valueType + " which is always between "
                            + displayMinimum() + " and " + displayMaximum()
                            + " inclusive, implementing " + ifaceName + ". Values outside "
                            + "that range are clamped to the nearest bound.")
                    .field("value", fld -> {
                        fld.withModifier(PRIVATE)
                                .ofType(valueType);
                    })
                    .field("serialVersionUID", fld -> {
                        fld.withModifier(PRIVATE, STATIC, FINAL)
                                .initializedWith(serialVersionUid());
                    })
                    .field("MINIMUM", fld -> {
                        fld.docComment("The minimum value of a " + className + ", inclusive.")
                                .withModifier(PUBLIC, STATIC, FINAL)
                                .initializedTo(storage.sourceLiteral(minimum))
                                .ofType(valueType);
                    })
                    .field("MAXIMUM", fld -> {
                        fld.docComment("The maximum value of a " + className + ", inclusive.")
                                .withModifier(PUBLIC, STATIC, FINAL)
                                .initializedTo(storage.sourceLiteral(maximum))
                                .ofType(valueType);
                    });

            if (el.getEnclosingElement().getKind() != ElementKind.PACKAGE) {
                result.importing(el.getQualifiedName().toString());
            }

            for (InputElement ie : toElements()) {
                ie.generateConstructor(result);
                ie.generateSetMethod(result);
            }
            new InputElement(UNSIGNED_LONG, this).generateSetMethod(result);

            result.method("ofUnsigned", mth -> {
                mth.withModifier(PUBLIC, STATIC)
                        .addArgument("long", "value")
                        .docComment("Create a new " + className + " from a long whose bits are "
                                + "treated as an unsigned 64-bit value, so -1L is 2^64 - 1."
                                + "\n@param value an unsigned value"
                                + "\n@return a " + className)
                        .returning(className)
                        .body(bb -> {
                            bb.returning("new " + className + "(MINIMUM).setUnsigned(value)");
                        });
            });

            if (!literal.isEmpty()) {
                result.method(literal, mth -> {
                    mth.withModifier(PUBLIC, STATIC)
                            .addArgument("long", "literal")
                            .docComment("Create a new " + className + " from a whole-number literal, "
                                    + "which is treated as unsigned and clamped into ["
                                    + displayMinimum() + ", " + displayMaximum() + "]."
                                    + "\n@param literal a literal"
                                    + "\n@return a " + className)
                            .returning(className)
                            .body(bb -> {
                                bb.returningInvocationOf("ofUnsigned")
                                        .withArgument("literal")
                                        .inScope();
                            });
                });
            }

            result.overridePublic(accessor.getSimpleName().toString())
                    .returning(valueType)
                    .bodyReturning("value");

            switch (supplierType()) {
                case "LongSupplier":
                    result.importing(LongSupplier.class);
                    break;
                case "DoubleSupplier":
                    result.importing(DoubleSupplier.class);
                    break;
                default:
                    result.importing(IntSupplier.class);
            }
            result.implementing(supplierType());
            result.overridePublic(supplierMethod())
                    .returning(storage == LONG ? "long" : storage.isFloatingPoint() ? "double" : "int")
                    .bodyReturning("value");

            result.overridePublic("number")
                    .returning(boxed)
                    .bodyReturning("value");
            result.overridePublic("minimum")
                    .returning(boxed)
                    .bodyReturning("MINIMUM");
            result.overridePublic("maximum")
                    .returning(boxed)
                    .bodyReturning("MAXIMUM");
            result.overridePublic("storageType")
                    .returning("Class<?>")
                    .bodyReturning(valueType + ".class");

            result.method("copy", mth -> {
                mth.withModifier(PUBLIC)
                        .docComment("Create an independent " + className + " with the same value."
                                + "\n@return a new " + className)
                        .returning(className)
                        .body(bb -> {
                            bb.returningNew(nb -> {
                                nb.withArgument("value")
                                        .ofType(className);
                            });
                        });
            });

            result.method("readResolve", mth -> {
                mth.withModifier(PRIVATE)
                        .docComment("Re-clamps deserialized values, which did not pass through a "
                                + "constructor.\n@return a " + className)
                        .returning("Object")
                        .body(bb -> {
                            bb.returningNew(nb -> {
                                nb.withArgument("value")
                                        .ofType(className);
                            });
                        });
            });

            result.overridePublic("compareTo")
                    .addArgument(className, "other")
                    .returning("int")
                    .bodyReturning(boxed + ".compare(value, other.value)");

            result.overridePublic("hashCode", hc -> {
                hc.returning("int")
                        .body(bb -> {
                            switch (storage) {
                                case LONG:
                                    bb.returning("(int) (102071L * (value ^ (value >>> 32)))");
                                    break;
                                case DOUBLE:
                                    bb.declare("bits")
                                            .initializedWith("Double.doubleToLongBits(value)")
                                            .as("long");
                                    bb.returning("(int) (102071L * (bits ^ (bits >>> 32)))");
                                    break;
                                case FLOAT:
                                    bb.returning("43867 * Float.floatToIntBits(value)");
                                    break;
                                default:
                                    bb.returning("43867 * value");
                            }
                        });
            });

            result.overridePublic("equals")
                    .addArgument("Object", "o")
                    .returning("boolean")
                    .body(bb -> {
                        bb.iff().booleanExpression("o == this")
                                .returning(true)
                                .elseIf().booleanExpression("o == null || o.getClass() != " + className + ".class")
                                .returning(false)
                                .endIf();
                        bb.returning(equalityTest("((" + className + ") o).value"));
                    });

            result.overridePublic("toString", ts -> {
                ts.returning("String")
                        .body(bb -> {
                            bb.returningStringConcatenation(ifaceName + "(", concat -> {
                                concat.appendExpression("value")
                                        .append(" in [" + displayMinimum() + ", " + displayMaximum() + "])");
                                concat.endConcatenation();
                            });
                        });
            });
            return result;
        }

        @Override
        public String toString() {
            return "BoundsModel{" + el.getQualifiedName() + " " + storage
                    + " [" + displayMinimum() + ", " + displayMaximum() + "] via " + on + '}';
        }
    }
}
