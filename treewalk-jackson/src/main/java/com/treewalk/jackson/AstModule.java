package com.treewalk.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.PropertyName;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.cfg.MapperConfig;
import com.fasterxml.jackson.databind.introspect.AnnotatedClass;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.introspect.VirtualAnnotatedMember;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.ser.VirtualBeanPropertyWriter;
import com.fasterxml.jackson.databind.util.Annotations;
import com.fasterxml.jackson.databind.util.SimpleBeanPropertyDefinition;
import com.treewalk.ast.BlockStatement;
import com.treewalk.ast.BreakStatement;
import com.treewalk.ast.CatchClause;
import com.treewalk.ast.ClassDeclaration;
import com.treewalk.ast.ClassExpression;
import com.treewalk.ast.ContinueStatement;
import com.treewalk.ast.Expression;
import com.treewalk.ast.ForStatement;
import com.treewalk.ast.FunctionDeclaration;
import com.treewalk.ast.FunctionExpression;
import com.treewalk.ast.Identifier;
import com.treewalk.ast.IfStatement;
import com.treewalk.ast.LineRange;
import com.treewalk.ast.Literal;
import com.treewalk.ast.MethodDefinition;
import com.treewalk.ast.Node;
import com.treewalk.ast.Pattern;
import com.treewalk.ast.PropertyDefinition;
import com.treewalk.ast.ReturnStatement;
import com.treewalk.ast.Statement;
import com.treewalk.ast.SwitchCase;
import com.treewalk.ast.TSEnumDeclaration;
import com.treewalk.ast.TSInterfaceDeclaration;
import com.treewalk.ast.TryStatement;
import com.treewalk.ast.VariableDeclarator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that shapes node records into ESTree JSON.
 *
 * This module handles:
 * - a leading {@code type} property and a {@code loc} object replacing startLine/endLine
 * - ESTree names for flags stored as isStatic / isAbstract / isConst
 * - explicit nulls for optional children ESTree always prints
 * - JavaScript number formatting for literal values
 */
public class AstModule extends SimpleModule {

    // written as part of loc, or re-added in front
    private static final Set<String> REPLACED_FIELDS = Set.of("type", "startLine", "endLine");

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, null, "com.treewalk", "treewalk-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(MethodDefinition.class, StaticMemberMixin.class);
        context.setMixInAnnotations(PropertyDefinition.class, PropertyDefinitionMixin.class);
        context.setMixInAnnotations(ClassDeclaration.class, ClassDeclarationMixin.class);
        context.setMixInAnnotations(ClassExpression.class, ClassExpressionMixin.class);
        context.setMixInAnnotations(TSEnumDeclaration.class, EnumMixin.class);
        context.setMixInAnnotations(TSInterfaceDeclaration.class, InterfaceMixin.class);
        context.setMixInAnnotations(FunctionDeclaration.class, FunctionIdMixin.class);
        context.setMixInAnnotations(FunctionExpression.class, FunctionIdMixin.class);
        context.setMixInAnnotations(VariableDeclarator.class, VariableDeclaratorMixin.class);
        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
        context.setMixInAnnotations(TryStatement.class, TryStatementMixin.class);
        context.setMixInAnnotations(ForStatement.class, ForStatementMixin.class);
        context.setMixInAnnotations(CatchClause.class, CatchClauseMixin.class);
        context.setMixInAnnotations(ReturnStatement.class, ReturnStatementMixin.class);
        context.setMixInAnnotations(BreakStatement.class, BreakContinueMixin.class);
        context.setMixInAnnotations(ContinueStatement.class, BreakContinueMixin.class);
        context.setMixInAnnotations(SwitchCase.class, SwitchCaseMixin.class);

        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    // ==================== Serialization Mixins ====================

    private abstract static class LiteralMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    private abstract static class StaticMemberMixin {
        @JsonProperty("static")
        abstract boolean isStatic();
    }

    private abstract static class PropertyDefinitionMixin extends StaticMemberMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression value();
    }

    private abstract static class ClassDeclarationMixin {
        @JsonProperty("abstract")
        abstract boolean isAbstract();

        @JsonProperty("implements")
        abstract List<?> implementsClause();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression superClass();
    }

    private abstract static class ClassExpressionMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression superClass();
    }

    private abstract static class EnumMixin {
        @JsonProperty("const")
        abstract boolean isConst();
    }

    private abstract static class InterfaceMixin {
        @JsonProperty("extends")
        abstract List<?> extendsClause();
    }

    private abstract static class FunctionIdMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();
    }

    private abstract static class VariableDeclaratorMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression init();
    }

    private abstract static class IfStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement alternate();
    }

    private abstract static class TryStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract CatchClause handler();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract BlockStatement finalizer();
    }

    private abstract static class ForStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Node init();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression test();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression update();
    }

    // null for optional catch binding
    private abstract static class CatchClauseMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Pattern param();
    }

    private abstract static class ReturnStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression argument();
    }

    private abstract static class BreakContinueMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier label();
    }

    // test is null for the default case
    private abstract static class SwitchCaseMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression test();
    }

    // ==================== Serializer Modifier ====================

    /**
     * Puts {@code type}, {@code start}, {@code end} and {@code loc} in front of every node's own
     * fields and drops the flat line components.
     */
    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }

            BeanPropertyWriter start = null;
            BeanPropertyWriter end = null;
            List<BeanPropertyWriter> rest = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                String name = prop.getName();
                if ("start".equals(name)) {
                    start = prop;
                } else if ("end".equals(name)) {
                    end = prop;
                } else if (!REPLACED_FIELDS.contains(name)) {
                    rest.add(prop);
                }
            }

            AnnotatedClass classInfo = beanDesc.getClassInfo();
            List<BeanPropertyWriter> ordered = new ArrayList<>(rest.size() + 4);
            ordered.add(new TypeWriter(definition(config, classInfo, "type", String.class),
                classInfo.getAnnotations(), config.constructType(String.class)));
            if (start != null) {
                ordered.add(start);
            }
            if (end != null) {
                ordered.add(end);
            }
            ordered.add(new LocWriter(definition(config, classInfo, "loc", LineRange.class),
                classInfo.getAnnotations(), config.constructType(LineRange.class)));
            ordered.addAll(rest);
            return ordered;
        }

        private static BeanPropertyDefinition definition(SerializationConfig config, AnnotatedClass classInfo,
                                                         String name, Class<?> rawType) {
            JavaType type = config.constructType(rawType);
            VirtualAnnotatedMember member = new VirtualAnnotatedMember(classInfo, classInfo.getRawType(), name, type);
            return SimpleBeanPropertyDefinition.construct(config, member, PropertyName.construct(name));
        }
    }

    /**
     * Writes {@link Node#type()}.
     */
    private static class TypeWriter extends VirtualBeanPropertyWriter {

        TypeWriter(BeanPropertyDefinition propDef, Annotations contextAnnotations, JavaType declaredType) {
            super(propDef, contextAnnotations, declaredType);
        }

        @Override
        protected Object value(Object bean, JsonGenerator gen, SerializerProvider prov) {
            return ((Node) bean).type();
        }

        @Override
        public VirtualBeanPropertyWriter withConfig(MapperConfig<?> config, AnnotatedClass declaringClass,
                                                    BeanPropertyDefinition propDef, JavaType type) {
            return new TypeWriter(propDef, declaringClass.getAnnotations(), type);
        }
    }

    /**
     * Writes {@code loc} as {@code {"startLine": n, "endLine": m}}.
     */
    private static class LocWriter extends VirtualBeanPropertyWriter {

        LocWriter(BeanPropertyDefinition propDef, Annotations contextAnnotations, JavaType declaredType) {
            super(propDef, contextAnnotations, declaredType);
        }

        @Override
        protected Object value(Object bean, JsonGenerator gen, SerializerProvider prov) {
            return ((Node) bean).lineRange();
        }

        @Override
        public VirtualBeanPropertyWriter withConfig(MapperConfig<?> config, AnnotatedClass declaringClass,
                                                    BeanPropertyDefinition propDef, JavaType type) {
            return new LocWriter(propDef, declaringClass.getAnnotations(), type);
        }
    }
}
