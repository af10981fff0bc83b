package org.carball.dpm.generation;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.WildcardTypeName;
import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.config.ConversionConfig;
import org.carball.dpm.exception.ModelGenerationException;
import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.ColumnReference;
import org.carball.dpm.model.schema.DatabaseSchema;
import org.carball.dpm.model.schema.Table;
import org.carball.dpm.transform.DependencyOrderer;
import org.carball.dpm.transform.TableOrder;

import javax.lang.model.element.Modifier;
import java.io.IOException;
import java.io.Serializable;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Generates the JPA entity model of a refined schema as a single Java source file.
 * <p>
 * The file holds one final class named after the configured model class, with a nested
 * static class per table in dependency order. Keyed tables become entities with
 * {@code @ManyToOne} links for their foreign keys and {@code @OneToMany} collections on the
 * referenced side; keyless tables become plain row classes. Every identifier is fixed
 * before any code is emitted, so the same schema always yields the same text.
 */
@Slf4j
public class ModelSynthesizer {

    private static final String JPA = "jakarta.persistence";
    private static final ClassName ENTITY = ClassName.get(JPA, "Entity");
    private static final ClassName TABLE = ClassName.get(JPA, "Table");
    private static final ClassName ID = ClassName.get(JPA, "Id");
    private static final ClassName ID_CLASS = ClassName.get(JPA, "IdClass");
    private static final ClassName COLUMN = ClassName.get(JPA, "Column");
    private static final ClassName MANY_TO_ONE = ClassName.get(JPA, "ManyToOne");
    private static final ClassName ONE_TO_MANY = ClassName.get(JPA, "OneToMany");
    private static final ClassName JOIN_COLUMN = ClassName.get(JPA, "JoinColumn");
    private static final ClassName FETCH_TYPE = ClassName.get(JPA, "FetchType");
    private static final ClassName CONVERT = ClassName.get(JPA, "Convert");
    private static final ClassName CONVERTER = ClassName.get(JPA, "Converter");
    private static final ClassName ATTRIBUTE_CONVERTER = ClassName.get(JPA, "AttributeConverter");

    static final String REFERENCES = "References";
    static final String KEY_CLASS = "Key";

    private final ConversionConfig config;
    private final RelationshipNamer namer;
    private final DependencyOrderer orderer;

    public ModelSynthesizer(ConversionConfig config) {
        this.config = config;
        this.namer = new RelationshipNamer(config.getRelationNameOverrides());
        this.orderer = new DependencyOrderer();
    }

    public String getFileName() {
        return config.getModelClassName() + ".java";
    }

    /**
     * Writes generated model source into the given directory.
     *
     * @return path of the written source file
     */
    public Path write(String source, Path directory) {
        Path file = directory.resolve(getFileName());
        try {
            Files.createDirectories(directory);
            Files.writeString(file, source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ModelGenerationException("Failed to write model to " + file, e);
        }
        log.info("Model written to {}", file);
        return file;
    }

    public String synthesize(DatabaseSchema schema) {
        return synthesize(schema, orderer.order(schema));
    }

    public String synthesize(DatabaseSchema schema, TableOrder tableOrder) {
        try {
            List<String> order = tableOrder.tables();
            String packageName = config.getModelPackage() == null ? "" : config.getModelPackage();
            ClassName holder = ClassName.get(packageName, config.getModelClassName());
            ClassName references = holder.nestedClass(REFERENCES);

            Map<String, TablePlan> plans = plan(schema, order, holder);

            TypeSpec.Builder model = TypeSpec.classBuilder(holder)
                    .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                    .addJavadoc("Entity model of the migrated database, one nested class per table.\n")
                    .addJavadoc("<p>\nGenerated by dpm-convert. Do not edit.\n")
                    .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build())
                    .addType(referencesAnnotation());

            for (String tableName : order) {
                model.addType(tableType(plans.get(tableName), plans, order, references));
            }

            log.debug("Synthesized {} model classes", order.size());
            return JavaFile.builder(packageName, model.build())
                    .skipJavaLangImports(true)
                    .indent("    ")
                    .build()
                    .toString();
        } catch (IllegalArgumentException e) {
            throw new ModelGenerationException("Failed to generate model: " + e.getMessage(), e);
        }
    }

    // Planning: every generated name is decided here, in table order then column order

    private Map<String, TablePlan> plan(DatabaseSchema schema, List<String> order, ClassName holder) {
        NameRegistry holderTypes = new NameRegistry(holder.simpleName(), List.of(holder.simpleName(), REFERENCES));
        Map<String, TablePlan> plans = new LinkedHashMap<>();
        for (String tableName : order) {
            Table table = schema.getTable(tableName);
            String simpleName = NameUtils.toPascalCase(tableName);
            ClassName type = holder.nestedClass(holderTypes.claim(simpleName.isEmpty() ? "Table" : simpleName));
            plans.put(tableName, new TablePlan(table, type, table.keyColumns(config.getIdentityColumn())));
        }

        List<String> topLevelNames = new ArrayList<>(List.of(holder.simpleName(), REFERENCES));
        plans.values().forEach(p -> topLevelNames.add(p.type.simpleName()));

        for (TablePlan plan : plans.values()) {
            planColumns(plan, topLevelNames);
        }
        for (TablePlan plan : plans.values()) {
            planOwningRelations(plan, schema, plans);
        }
        for (TablePlan plan : plans.values()) {
            for (Relation relation : plan.manyToOne) {
                planInverseRelation(relation);
            }
        }
        for (TablePlan plan : plans.values()) {
            planAccessors(plan);
        }
        return plans;
    }

    private void planColumns(TablePlan plan, List<String> topLevelNames) {
        plan.nestedTypes.reserve(plan.type.simpleName());
        topLevelNames.forEach(plan.nestedTypes::reserve);
        if (plan.table.hasCompositePrimaryKey()) {
            plan.keyClass = plan.type.nestedClass(plan.nestedTypes.claim(KEY_CLASS));
        }

        for (Column column : plan.table.getColumns()) {
            String fieldName = NameUtils.escapeKeyword(NameUtils.toCamelCase(column.getName()));
            plan.fieldNames.put(column.getName(),
                    plan.members.claim(fieldName.isEmpty() ? "column" + column.getOrdinal() : fieldName));

            if (column.isEnumerated()) {
                String enumName = NameUtils.toPascalCase(column.getName());
                if (enumName.isEmpty() || plan.nestedTypes.isTaken(enumName)) {
                    enumName = enumName + "Value";
                }
                ClassName enumType = plan.type.nestedClass(plan.nestedTypes.claim(enumName));
                ClassName converter = plan.type.nestedClass(plan.nestedTypes.claim(enumType.simpleName() + "Converter"));

                NameRegistry constants = new NameRegistry(plan.table.getName() + "." + column.getName());
                Map<String, String> constantNames = new LinkedHashMap<>();
                for (String value : column.getEnumDomain()) {
                    constantNames.put(value, constants.claim(NameUtils.toConstantName(value)));
                }
                plan.enums.put(column.getName(), new EnumPlan(enumType, converter, constantNames));
            }
        }
    }

    private void planOwningRelations(TablePlan plan, DatabaseSchema schema, Map<String, TablePlan> plans) {
        if (!plan.isKeyed()) {
            return;
        }
        List<Relation> direct = new ArrayList<>();
        List<Relation> sameAsTarget = new ArrayList<>();
        for (Column column : plan.table.foreignKeyColumns()) {
            Optional<TablePlan> target = schema.findTable(column.getForeignKey().table())
                    .map(t -> plans.get(t.getName()));
            if (target.isEmpty() || !target.get().isKeyed()) {
                log.debug("No relationship for {}.{}: {} is not a keyed table",
                        plan.table.getName(), column.getName(), column.getForeignKey().table());
                continue;
            }
            Relation relation = new Relation(plan, column, target.get());
            if (namer.baseName(plan.table.getName(), column).equals(target.get().table.getName())) {
                sameAsTarget.add(relation);
            } else {
                direct.add(relation);
            }
        }

        // Names that differ from their target table claim first; plain table names take what is left
        direct.addAll(sameAsTarget);
        for (Relation relation : direct) {
            relation.fieldName = plan.members.claim(namer.fieldName(plan.table.getName(), relation.column));
            plan.manyToOne.add(relation);
        }
    }

    private void planInverseRelation(Relation relation) {
        TablePlan target = relation.target;
        if (target.table.getName().equalsIgnoreCase(config.getHubTable())
                || relation.column.referencesItself(relation.source.table.getName())) {
            return;
        }
        String plural = NameUtils.pluralize(relation.source.type.simpleName());
        String baseName = namer.baseName(relation.source.table.getName(), relation.column);
        String candidate = baseName.equals(target.table.getName())
                ? NameUtils.toCamelCase(plural)
                : NameUtils.toCamelCase(baseName) + NameUtils.toPascalCase(plural);
        relation.inverseFieldName = target.members.claim(NameUtils.escapeKeyword(candidate));
        target.oneToMany.add(relation);
    }

    private void planAccessors(TablePlan plan) {
        for (Column column : plan.table.getColumns()) {
            String fieldName = plan.fieldNames.get(column.getName());
            plan.getters.put(fieldName, claimGetter(plan, fieldName, fieldType(plan, column)));
            plan.setters.put(fieldName, plan.methods.claim("set" + capitalize(fieldName)));
        }
        for (Relation relation : plan.manyToOne) {
            plan.getters.put(relation.fieldName, claimGetter(plan, relation.fieldName, relation.target.type));
        }
        for (Relation relation : plan.oneToMany) {
            plan.getters.put(relation.inverseFieldName,
                    claimGetter(plan, relation.inverseFieldName, ClassName.get(List.class)));
        }
    }

    // IsActive and Active both want isActive(); the later one falls back to getActive()
    private static String claimGetter(TablePlan plan, String fieldName, TypeName type) {
        String plain = "get" + capitalize(fieldName);
        if (type.equals(TypeName.BOOLEAN)) {
            String predicate = fieldName.matches("is[A-Z0-9_].*") ? fieldName : "is" + capitalize(fieldName);
            if (!plan.methods.isTaken(predicate)) {
                return plan.methods.claim(predicate);
            }
        }
        return plan.methods.claim(plain);
    }

    // Emission

    private TypeSpec tableType(TablePlan plan, Map<String, TablePlan> plans, List<String> order,
                               ClassName references) {
        Table table = plan.table;
        TypeSpec.Builder type = TypeSpec.classBuilder(plan.type)
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC);

        if (plan.isKeyed()) {
            type.addJavadoc("Rows of the {@code $L} table.\n", table.getName())
                    .addAnnotation(ENTITY)
                    .addAnnotation(AnnotationSpec.builder(TABLE)
                            .addMember("name", "$S", table.getName())
                            .build());
            if (plan.keyClass != null) {
                type.addAnnotation(AnnotationSpec.builder(ID_CLASS)
                        .addMember("value", "$T.class", plan.keyClass)
                        .build());
            }
        } else {
            type.addJavadoc("Rows of the keyless {@code $L} table. Not an entity: load them with a query.\n",
                    table.getName());
        }

        for (EnumPlan enumPlan : enumPlansInColumnOrder(plan)) {
            type.addType(enumType(enumPlan, table.getName()));
            type.addType(converterType(enumPlan));
        }
        if (plan.keyClass != null) {
            type.addType(keyType(plan));
        }

        List<MethodSpec> accessors = new ArrayList<>();
        for (Column column : table.getColumns()) {
            String fieldName = plan.fieldNames.get(column.getName());
            TypeName fieldType = fieldType(plan, column);
            type.addField(columnField(plan, column, fieldName, fieldType, plans, order, references));
            accessors.add(getter(plan.getters.get(fieldName), fieldName, fieldType));
            accessors.add(setter(plan.setters.get(fieldName), fieldName, fieldType));
        }

        for (Relation relation : plan.manyToOne) {
            type.addField(manyToOneField(relation));
            accessors.add(getter(plan.getters.get(relation.fieldName), relation.fieldName, relation.target.type));
        }
        for (Relation relation : plan.oneToMany) {
            TypeName listType = ParameterizedTypeName.get(ClassName.get(List.class), relation.source.type);
            type.addField(FieldSpec.builder(listType, relation.inverseFieldName, Modifier.PRIVATE)
                    .addAnnotation(AnnotationSpec.builder(ONE_TO_MANY)
                            .addMember("mappedBy", "$S", relation.fieldName)
                            .build())
                    .initializer("new $T<>()", ArrayList.class)
                    .build());
            accessors.add(getter(plan.getters.get(relation.inverseFieldName), relation.inverseFieldName, listType));
        }

        type.addMethods(accessors);
        return type.build();
    }

    private FieldSpec columnField(TablePlan plan, Column column, String fieldName, TypeName fieldType,
                                  Map<String, TablePlan> plans, List<String> order, ClassName references) {
        FieldSpec.Builder field = FieldSpec.builder(fieldType, fieldName, Modifier.PRIVATE);
        if (plan.isKeyed() && plan.keyColumns.contains(column)) {
            field.addAnnotation(ID);
        }

        AnnotationSpec.Builder columnAnnotation = AnnotationSpec.builder(COLUMN)
                .addMember("name", "$S", column.getName());
        if (!column.isNullable()) {
            columnAnnotation.addMember("nullable", "$L", false);
        }
        field.addAnnotation(columnAnnotation.build());

        EnumPlan enumPlan = plan.enums.get(column.getName());
        if (enumPlan != null) {
            field.addAnnotation(AnnotationSpec.builder(CONVERT)
                    .addMember("converter", "$T.class", enumPlan.converter)
                    .build());
        }

        if (column.isForeignKey()) {
            field.addAnnotation(referencesAnnotation(plan, column.getForeignKey(), plans, order, references));
        }
        return field.build();
    }

    /**
     * Points a key column at its target. The hub table is referenced by most other tables, so
     * its own references to tables that come later in the file are written by table name.
     */
    private AnnotationSpec referencesAnnotation(TablePlan plan, ColumnReference reference,
                                                Map<String, TablePlan> plans, List<String> order,
                                                ClassName references) {
        AnnotationSpec.Builder annotation = AnnotationSpec.builder(references);
        String target = order.stream()
                .filter(name -> name.equalsIgnoreCase(reference.table()))
                .findFirst()
                .orElse(null);
        boolean deferred = target == null
                || (plan.table.getName().equalsIgnoreCase(config.getHubTable())
                && order.indexOf(target) > order.indexOf(plan.table.getName()));

        if (deferred) {
            annotation.addMember("table", "$S", target == null ? reference.table() : target);
        } else {
            annotation.addMember("value", "$T.class", plans.get(target).type);
        }
        return annotation.addMember("column", "$S", reference.column()).build();
    }

    private FieldSpec manyToOneField(Relation relation) {
        Column column = relation.column;
        return FieldSpec.builder(relation.target.type, relation.fieldName, Modifier.PRIVATE)
                .addAnnotation(AnnotationSpec.builder(MANY_TO_ONE)
                        .addMember("fetch", "$T.LAZY", FETCH_TYPE)
                        .addMember("optional", "$L", column.isNullable())
                        .build())
                .addAnnotation(AnnotationSpec.builder(JOIN_COLUMN)
                        .addMember("name", "$S", column.getName())
                        .addMember("referencedColumnName", "$S", column.getForeignKey().column())
                        .addMember("insertable", "$L", false)
                        .addMember("updatable", "$L", false)
                        .build())
                .build();
    }

    private TypeName fieldType(TablePlan plan, Column column) {
        EnumPlan enumPlan = plan.enums.get(column.getName());
        if (enumPlan != null) {
            return enumPlan.type;
        }
        TypeName type = switch (column.getType()) {
            case DATE -> ClassName.get(LocalDate.class);
            case DATETIME -> ClassName.get(LocalDateTime.class);
            case BOOLEAN -> TypeName.BOOLEAN;
            case INTEGER -> TypeName.INT;
            case DECIMAL -> ClassName.get(BigDecimal.class);
            case FLOAT -> TypeName.DOUBLE;
            case BINARY -> ArrayTypeName.of(TypeName.BYTE);
            case IDENTIFIER, TEXT -> ClassName.get(String.class);
        };
        return column.isNullable() ? type.box() : type;
    }

    private TypeSpec enumType(EnumPlan enumPlan, String tableName) {
        TypeSpec.Builder type = TypeSpec.enumBuilder(enumPlan.type)
                .addModifiers(Modifier.PUBLIC);
        enumPlan.constants.forEach((value, constant) ->
                type.addEnumConstant(constant, TypeSpec.anonymousClassBuilder("$S", value).build()));

        return type.addField(String.class, "value", Modifier.PRIVATE, Modifier.FINAL)
                .addMethod(MethodSpec.constructorBuilder()
                        .addParameter(String.class, "value")
                        .addStatement("this.value = value")
                        .build())
                .addMethod(MethodSpec.methodBuilder("getValue")
                        .addModifiers(Modifier.PUBLIC)
                        .returns(String.class)
                        .addStatement("return value")
                        .build())
                .addMethod(MethodSpec.methodBuilder("fromValue")
                        .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                        .returns(enumPlan.type)
                        .addParameter(String.class, "value")
                        .beginControlFlow("for ($T candidate : values())", enumPlan.type)
                        .beginControlFlow("if (candidate.value.equals(value))")
                        .addStatement("return candidate")
                        .endControlFlow()
                        .endControlFlow()
                        .addStatement("throw new $T($S + value)", IllegalArgumentException.class,
                                "Unknown " + tableName + " value: ")
                        .build())
                .build();
    }

    private TypeSpec converterType(EnumPlan enumPlan) {
        ClassName string = ClassName.get(String.class);
        return TypeSpec.classBuilder(enumPlan.converter)
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .addAnnotation(CONVERTER)
                .addSuperinterface(ParameterizedTypeName.get(ATTRIBUTE_CONVERTER, enumPlan.type, string))
                .addMethod(MethodSpec.methodBuilder("convertToDatabaseColumn")
                        .addAnnotation(Override.class)
                        .addModifiers(Modifier.PUBLIC)
                        .returns(string)
                        .addParameter(enumPlan.type, "attribute")
                        .addStatement("return attribute == null ? null : attribute.getValue()")
                        .build())
                .addMethod(MethodSpec.methodBuilder("convertToEntityAttribute")
                        .addAnnotation(Override.class)
                        .addModifiers(Modifier.PUBLIC)
                        .returns(enumPlan.type)
                        .addParameter(string, "dbData")
                        .addStatement("return dbData == null ? null : $T.fromValue(dbData)", enumPlan.type)
                        .build())
                .build();
    }

    private TypeSpec keyType(TablePlan plan) {
        TypeSpec.Builder key = TypeSpec.classBuilder(plan.keyClass)
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .addSuperinterface(Serializable.class);

        List<String> names = new ArrayList<>();
        for (Column column : plan.keyColumns) {
            String fieldName = plan.fieldNames.get(column.getName());
            key.addField(fieldType(plan, column), fieldName, Modifier.PRIVATE);
            names.add(fieldName);
        }

        String comparison = names.stream()
                .map(name -> "$T.equals(" + name + ", other." + name + ")")
                .collect(Collectors.joining(" && "));
        Object[] objectsArgs = names.stream().map(name -> Objects.class).toArray();

        return key
                .addMethod(MethodSpec.methodBuilder("equals")
                        .addAnnotation(Override.class)
                        .addModifiers(Modifier.PUBLIC)
                        .returns(TypeName.BOOLEAN)
                        .addParameter(Object.class, "o")
                        .beginControlFlow("if (this == o)")
                        .addStatement("return true")
                        .endControlFlow()
                        .beginControlFlow("if (!(o instanceof $T))", plan.keyClass)
                        .addStatement("return false")
                        .endControlFlow()
                        .addStatement("$T other = ($T) o", plan.keyClass, plan.keyClass)
                        .addStatement("return " + comparison, objectsArgs)
                        .build())
                .addMethod(MethodSpec.methodBuilder("hashCode")
                        .addAnnotation(Override.class)
                        .addModifiers(Modifier.PUBLIC)
                        .returns(TypeName.INT)
                        .addStatement("return $T.hash($L)", Objects.class, String.join(", ", names))
                        .build())
                .build();
    }

    private static TypeSpec referencesAnnotation() {
        TypeName anyClass = ParameterizedTypeName.get(ClassName.get(Class.class), WildcardTypeName.subtypeOf(Object.class));
        return TypeSpec.annotationBuilder(REFERENCES)
                .addModifiers(Modifier.PUBLIC)
                .addJavadoc("Source-level foreign key: the referenced model class, or the table name where\n")
                .addJavadoc("the class is declared further down, and the referenced column.\n")
                .addAnnotation(AnnotationSpec.builder(Retention.class)
                        .addMember("value", "$T.RUNTIME", RetentionPolicy.class)
                        .build())
                .addAnnotation(AnnotationSpec.builder(Target.class)
                        .addMember("value", "$T.FIELD", ElementType.class)
                        .build())
                .addMethod(MethodSpec.methodBuilder("value")
                        .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
                        .returns(anyClass)
                        .defaultValue("void.class")
                        .build())
                .addMethod(MethodSpec.methodBuilder("table")
                        .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
                        .returns(String.class)
                        .defaultValue("$S", "")
                        .build())
                .addMethod(MethodSpec.methodBuilder("column")
                        .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
                        .returns(String.class)
                        .build())
                .build();
    }

    private static MethodSpec getter(String name, String fieldName, TypeName type) {
        return MethodSpec.methodBuilder(name)
                .addModifiers(Modifier.PUBLIC)
                .returns(type)
                .addStatement("return $N", fieldName)
                .build();
    }

    private static MethodSpec setter(String name, String fieldName, TypeName type) {
        return MethodSpec.methodBuilder(name)
                .addModifiers(Modifier.PUBLIC)
                .addParameter(type, fieldName)
                .addStatement("this.$N = $N", fieldName, fieldName)
                .build();
    }

    private static String capitalize(String name) {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static List<EnumPlan> enumPlansInColumnOrder(TablePlan plan) {
        return plan.table.getColumns().stream()
                .map(c -> plan.enums.get(c.getName()))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    private static final class TablePlan {
        final Table table;
        final ClassName type;
        final List<Column> keyColumns;
        final NameRegistry members;
        final NameRegistry nestedTypes;
        final NameRegistry methods;
        final Map<String, String> fieldNames = new LinkedHashMap<>();
        final Map<String, EnumPlan> enums = new LinkedHashMap<>();
        final Map<String, String> getters = new LinkedHashMap<>();
        final Map<String, String> setters = new LinkedHashMap<>();
        final List<Relation> manyToOne = new ArrayList<>();
        final List<Relation> oneToMany = new ArrayList<>();
        ClassName keyClass;

        TablePlan(Table table, ClassName type, List<Column> keyColumns) {
            this.table = table;
            this.type = type;
            this.keyColumns = keyColumns;
            this.members = new NameRegistry(table.getName());
            this.nestedTypes = new NameRegistry(table.getName());
            this.methods = new NameRegistry(table.getName());
        }

        boolean isKeyed() {
            return !keyColumns.isEmpty();
        }
    }

    private static final class Relation {
        final TablePlan source;
        final Column column;
        final TablePlan target;
        String fieldName;
        String inverseFieldName;

        Relation(TablePlan source, Column column, TablePlan target) {
            this.source = source;
            this.column = column;
            this.target = target;
        }
    }

    private record EnumPlan(ClassName type, ClassName converter, Map<String, String> constants) {
    }
}
