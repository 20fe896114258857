package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.analysis.types.LumenTypes;
import com.lumenlang.compiler.resolve.CallableReferenceAccess;
import com.lumenlang.compiler.resolve.ExplicitReceiverKind;
import com.lumenlang.ir.IrInternalError;
import com.lumenlang.ir.declarations.*;
import com.lumenlang.ir.expressions.*;
import com.lumenlang.ir.symbols.IrFunctionSymbol;
import com.lumenlang.ir.symbols.IrValueParameterSymbol;
import com.lumenlang.ir.types.IrSimpleType;
import com.lumenlang.ir.types.IrType;
import com.lumenlang.ir.types.IrTypePredicates;
import com.lumenlang.ir.util.IrFactoryImpl;
import com.lumenlang.ir.util.IrRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AdapterSynthesizer 可调用引用适配")
class AdapterSynthesizerTest {

    private LoweringFixture fx;
    private AdapterSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        fx = new LoweringFixture();
        synthesizer = new AdapterSynthesizer(fx.context);
    }

    private static IrSimpleFunction adapterOf(IrExpression result) {
        if (result instanceof IrFunctionExpression) {
            return ((IrFunctionExpression) result).getFunction();
        }
        return (IrSimpleFunction) ((IrBlock) result).getStatements().get(0);
    }

    private static IrExpression bodyStatement(IrFunction adapter) {
        return (IrExpression) adapter.getBody().getStatements().get(0);
    }

    /** 适配函数体内的被引用函数调用（去掉 return） */
    private static IrMemberAccessExpression<?> adapteeCall(IrExpression result) {
        IrExpression statement = bodyStatement(adapterOf(result));
        if (statement instanceof IrReturn) {
            statement = ((IrReturn) statement).getValue();
        }
        return (IrMemberAccessExpression<?>) statement;
    }

    private static String renderCall(IrExpression result) {
        return IrRenderer.render(adapteeCall(result));
    }

    // ============ needsAdapter ============

    @Nested
    @DisplayName("是否需要适配")
    class NeedsAdapter {

        @Test
        @DisplayName("期望挂起函数类型而被引用函数不是 suspend")
        void suspendExpected() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.intType());
            fx.parameter(f, "x", fx.builtIns.intType());
            IrSimpleType type = fx.kSuspendFunctionType(fx.builtIns.intType(), fx.builtIns.intType());

            assertThat(synthesizer.needsSuspendConversion(type, f)).isTrue();
            assertThat(synthesizer.needsAdapter(LoweringFixture.reference("f").build(), type, f)).isTrue();
        }

        @Test
        @DisplayName("被引用函数本身是 suspend 时不需要挂起转换")
        void suspendAdaptee() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.intType(), IrModifier.SUSPEND);
            IrSimpleType type = fx.suspendFunctionType(fx.builtIns.intType());

            assertThat(synthesizer.needsAdapter(LoweringFixture.reference("f").build(), type, f)).isFalse();
        }

        @Test
        @DisplayName("关闭挂起转换后不再判定")
        void suspendConversionDisabled() {
            fx.settings.setSuspendConversionEnabled(false);
            IrSimpleFunction f = fx.function("f", fx.builtIns.intType());
            IrSimpleType type = fx.suspendFunctionType(fx.builtIns.intType());

            assertThat(synthesizer.needsSuspendConversion(type, f)).isFalse();
        }

        @Test
        @DisplayName("期望返回 Unit 而被引用函数返回其他类型")
        void coercionToUnit() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.stringType());
            IrSimpleFunction g = fx.function("g", fx.builtIns.unitType());
            IrSimpleType type = fx.kFunctionType(fx.builtIns.unitType());

            assertThat(synthesizer.needsCoercionToUnit(type, f)).isTrue();
            assertThat(synthesizer.needsCoercionToUnit(type, g)).isFalse();
        }

        @Test
        @DisplayName("可空 Unit 返回类型不触发 Unit 强转")
        void nullableUnitIsNotUnit() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.stringType());
            IrType nullableUnit = fx.builtIns.unitType().withNullable(true);
            IrSimpleType type = fx.functionType(nullableUnit);

            assertThat(synthesizer.needsCoercionToUnit(type, f)).isFalse();
        }

        @Test
        @DisplayName("按元素传 vararg 时需要展开，按数组传时不需要")
        void varargElementVersusArray() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.stringType());
            fx.varargParameter(f, "xs", fx.builtIns.charType());
            CallableReferenceAccess reference = LoweringFixture.reference("f").build();

            IrSimpleType byElement = fx.kFunctionType(fx.builtIns.stringType(), fx.builtIns.charType());
            IrSimpleType byArray = fx.kFunctionType(fx.builtIns.stringType(), fx.builtIns.charArrayType());

            assertThat(synthesizer.needsVarargSpread(reference, byElement, f)).isTrue();
            assertThat(synthesizer.needsVarargSpread(reference, byArray, f)).isFalse();
        }

        @Test
        @DisplayName("A::foo 的第一个期望参数是接收者，vararg 判定右移一位")
        void qualifierShift() {
            IrClass box = fx.userClass("Box");
            IrSimpleFunction f = fx.member(box, "f", fx.builtIns.stringType());
            fx.varargParameter(f, "xs", fx.builtIns.charType());
            CallableReferenceAccess reference = LoweringFixture.reference("f")
                    .explicitReceiver(ExplicitReceiverKind.RESOLVED_QUALIFIER)
                    .dispatchReceiver(true)
                    .build();

            IrSimpleType shifted = fx.kFunctionType(fx.builtIns.stringType(),
                    box.getDefaultType(), fx.builtIns.charType());
            assertThat(synthesizer.needsVarargSpread(reference, shifted, f)).isTrue();

            IrSimpleType arrayAfterReceiver = fx.kFunctionType(fx.builtIns.stringType(),
                    box.getDefaultType(), fx.builtIns.charArrayType());
            assertThat(synthesizer.needsVarargSpread(reference, arrayAfterReceiver, f)).isFalse();
        }

        @Test
        @DisplayName("期望参数少于被引用函数参数时不判定 vararg 展开")
        void expectedTooShort() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.stringType());
            fx.parameter(f, "a", fx.builtIns.intType());
            fx.varargParameter(f, "xs", fx.builtIns.charType());
            IrSimpleType type = fx.functionType(fx.builtIns.stringType(), fx.builtIns.intType());

            assertThat(synthesizer.needsVarargSpread(LoweringFixture.reference("f").build(), type, f)).isFalse();
        }

        @Test
        @DisplayName("完全匹配的引用不需要适配")
        void exactMatch() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.intType());
            fx.parameter(f, "x", fx.builtIns.intType());
            IrSimpleType type = fx.kFunctionType(fx.builtIns.intType(), fx.builtIns.intType());

            assertThat(synthesizer.needsAdapter(LoweringFixture.reference("f").build(), type, f)).isFalse();
        }
    }

    // ============ 反射函数类型 ============

    @Nested
    @DisplayName("KFunction 到 Function")
    class KFunctionToFunction {

        @Test
        @DisplayName("反射函数类型换成非反射类型，实参不变")
        void convertsReflectKinds() {
            IrSimpleType kFunction = fx.kFunctionType(fx.builtIns.intType(), fx.builtIns.stringType());
            IrSimpleType kSuspend = fx.kSuspendFunctionType(fx.builtIns.unitType());

            IrSimpleType function = synthesizer.kFunctionTypeToFunctionType(kFunction);
            IrSimpleType suspend = synthesizer.kFunctionTypeToFunctionType(kSuspend);

            assertThat(IrTypePredicates.isFunction(function)).isTrue();
            assertThat(function.getArguments()).isEqualTo(kFunction.getArguments());
            assertThat(IrTypePredicates.isSuspendFunction(suspend)).isTrue();
            assertThat(suspend.render()).isEqualTo("SuspendFunction0<Unit>");
        }

        @Test
        @DisplayName("非反射函数类型原样返回")
        void nonReflectUnchanged() {
            IrSimpleType function = fx.functionType(fx.builtIns.intType());
            assertThat(synthesizer.kFunctionTypeToFunctionType(function)).isSameAs(function);
        }

        @Test
        @DisplayName("非函数类型抛出异常")
        void rejectsNonFunction() {
            assertThatThrownBy(() -> synthesizer.kFunctionTypeToFunctionType(fx.builtIns.intType()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Not a function type");
        }
    }

    // ============ 未绑定引用 ============

    @Nested
    @DisplayName("未绑定引用")
    class Unbound {

        @Test
        @DisplayName("参数一一转发，期望返回 Unit 时函数体为裸调用")
        void forwardsParametersAndCoercesToUnit() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.intType());
            fx.parameter(f, "a", fx.builtIns.intType());
            fx.parameter(f, "b", fx.builtIns.intType());
            IrSimpleType type = fx.functionType(fx.builtIns.unitType(), fx.builtIns.intType(), fx.builtIns.intType());

            IrExpression result = synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("f").build(), null, f.getSymbol(), type);

            assertThat(result).isInstanceOf(IrFunctionExpression.class);
            assertThat(IrRenderer.render(result))
                    .isEqualTo("fun-expr(local fun f(p0: Int, p1: Int): Unit { f(p0, p1) })");
            assertThat(((IrFunctionExpression) result).getOrigin())
                    .isEqualTo(IrStatementOrigin.ADAPTED_FUNCTION_REFERENCE);
            assertThat(result.getType()).isEqualTo(type);
        }

        @Test
        @DisplayName("挂起适配函数带 suspend 修饰并返回调用结果")
        void suspendAdapter() {
            IrSimpleFunction g = fx.function("g", fx.builtIns.stringType());
            fx.parameter(g, "x", fx.builtIns.intType());
            IrSimpleType type = fx.suspendFunctionType(fx.builtIns.stringType(), fx.builtIns.intType());

            IrExpression result = synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("g").build(), null, g.getSymbol(), type);

            IrSimpleFunction adapter = adapterOf(result);
            assertThat(adapter.isSuspend()).isTrue();
            assertThat(bodyStatement(adapter)).isInstanceOf(IrReturn.class);
            assertThat(((IrReturn) bodyStatement(adapter)).getReturnTargetSymbol()).isSameAs(adapter.getSymbol());
            assertThat(IrRenderer.render(result))
                    .isEqualTo("fun-expr(local suspend fun g(p0: Int): String { return g(p0) })");
        }

        @Test
        @DisplayName("适配函数的声明属性")
        void adapterDeclaration() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.intType(), IrModifier.INLINE, IrModifier.INFIX);
            fx.parameter(f, "a", fx.builtIns.intType());
            IrSimpleType type = fx.functionType(fx.builtIns.unitType(), fx.builtIns.intType());

            IrSimpleFunction adapter = adapterOf(synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("f").build(), null, f.getSymbol(), type));

            assertThat(adapter.getName()).isEqualTo("f");
            assertThat(adapter.getOrigin()).isEqualTo(IrDeclarationOrigin.ADAPTER_FOR_CALLABLE_REFERENCE);
            assertThat(adapter.getVisibility()).isEqualTo(IrVisibility.LOCAL);
            assertThat(adapter.getModality()).isEqualTo(IrModality.FINAL);
            assertThat(adapter.getModifiers()).containsExactlyInAnyOrder(IrModifier.INLINE, IrModifier.INFIX);
            assertThat(adapter.getReturnType()).isEqualTo(fx.builtIns.unitType());
            assertThat(adapter.getParent()).isSameAs(fx.file);
            assertThat(adapter.getStartOffset()).isEqualTo(10);
            assertThat(adapter.getEndOffset()).isEqualTo(30);
            assertThat(adapter.getExtensionReceiverParameter()).isNull();
            for (IrValueParameter parameter : adapter.getValueParameters()) {
                assertThat(parameter.getOrigin()).isEqualTo(IrDeclarationOrigin.ADAPTER_PARAMETER_FOR_CALLABLE_REFERENCE);
                assertThat(parameter.getParent()).isSameAs(adapter);
            }
        }

        @Test
        @DisplayName("调用使用被引用函数的源码位置")
        void callOffsetsFromAdaptee() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.intType());
            IrSimpleType type = fx.functionType(fx.builtIns.unitType());

            IrMemberAccessExpression<?> call = adapteeCall(synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("f").build(), null, f.getSymbol(), type));

            assertThat(call.getStartOffset()).isEqualTo(100);
            assertThat(call.getEndOffset()).isEqualTo(200);
            assertThat(call.getType()).isEqualTo(fx.builtIns.intType());
        }

        @Test
        @DisplayName("有默认值的参数不传实参")
        void defaultParameterLeftEmpty() {
            IrSimpleFunction d = fx.function("d", fx.builtIns.intType());
            fx.parameter(d, "a", fx.builtIns.intType());
            fx.defaultParameter(d, "b", fx.builtIns.intType());
            IrSimpleType type = fx.functionType(fx.builtIns.intType(), fx.builtIns.intType());

            IrExpression result = synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("d").build(), null, d.getSymbol(), type);

            assertThat(renderCall(result)).isEqualTo("d(p0, _)");
            assertThat(adapteeCall(result).getValueArgument(1)).isNull();
        }

        @Test
        @DisplayName("适配参数不足时报内部错误")
        void tooFewParameters() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.unitType());
            fx.parameter(f, "a", fx.builtIns.intType());
            fx.parameter(f, "b", fx.builtIns.intType());
            IrSimpleType type = fx.functionType(fx.builtIns.unitType(), fx.builtIns.intType());

            assertThatThrownBy(() -> synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("f").build(), null, f.getSymbol(), type))
                    .isInstanceOf(IrInternalError.class)
                    .hasMessageContaining("too few parameters");
            assertThat(fx.symbolTable.getScopeDepth()).isZero();
        }

        @Test
        @DisplayName("显式类型实参依次填入调用")
        void typeArguments() {
            IrSimpleFunction id = fx.function("id", fx.builtIns.anyType());
            IrTypeParameter t = fx.typeParameter(id, "T");
            fx.parameter(id, "x", t.getDefaultType());
            IrSimpleType type = fx.functionType(fx.builtIns.stringType(), fx.builtIns.stringType());
            CallableReferenceAccess reference = LoweringFixture.reference("id")
                    .typeArguments(Collections.singletonList(LumenTypes.STRING))
                    .build();

            IrExpression result = synthesizer.synthesizeForCallableReference(reference, null, id.getSymbol(), type);

            assertThat(renderCall(result)).isEqualTo("id<String>(p0)");
        }
    }

    // ============ vararg ============

    @Nested
    @DisplayName("vararg 展开")
    class Vararg {

        private IrSimpleFunction h;

        @BeforeEach
        void declare() {
            h = fx.function("h", fx.builtIns.stringType());
            fx.varargParameter(h, "xs", fx.builtIns.charType());
        }

        private String adapt(IrType... parameterTypes) {
            IrSimpleType type = fx.functionType(fx.builtIns.stringType(), parameterTypes);
            return renderCall(synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("h").build(), null, h.getSymbol(), type));
        }

        @Test
        @DisplayName("逐个元素收集进 vararg")
        void elements() {
            assertThat(adapt(fx.builtIns.charType(), fx.builtIns.charType())).isEqualTo("h(vararg(p0, p1))");
        }

        @Test
        @DisplayName("数组类型参数作为单个展开元素")
        void wholeArray() {
            assertThat(adapt(fx.builtIns.charArrayType())).isEqualTo("h(vararg(*p0))");
        }

        @Test
        @DisplayName("遇到数组后停止消费")
        void stopsAfterWholeArray() {
            IrSimpleFunction k = fx.function("k", fx.builtIns.stringType());
            fx.varargParameter(k, "xs", fx.builtIns.charType());
            fx.defaultParameter(k, "sep", fx.builtIns.stringType());
            IrSimpleType type = fx.functionType(fx.builtIns.stringType(),
                    fx.builtIns.charType(), fx.builtIns.charArrayType(), fx.builtIns.charType());

            IrExpression result = synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("k").build(), null, k.getSymbol(), type);

            assertThat(renderCall(result)).isEqualTo("k(vararg(p0, *p1), _)");
        }

        @Test
        @DisplayName("类型既不是数组也不是元素时不传实参")
        void mismatch() {
            assertThat(adapt(fx.builtIns.stringType())).isEqualTo("h(_)");
        }

        @Test
        @DisplayName("没有剩余适配参数时不传实参")
        void noParametersLeft() {
            assertThat(adapt()).isEqualTo("h(_)");
        }

        @Test
        @DisplayName("vararg 表达式携带参数的数组类型与元素类型")
        void varargTypes() {
            IrSimpleType type = fx.functionType(fx.builtIns.stringType(), fx.builtIns.charType());
            IrMemberAccessExpression<?> call = adapteeCall(synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("h").build(), null, h.getSymbol(), type));

            IrVararg vararg = (IrVararg) call.getValueArgument(0);
            assertThat(vararg.getType()).isEqualTo(fx.builtIns.charArrayType());
            assertThat(vararg.getVarargElementType()).isEqualTo(fx.builtIns.charType());
        }
    }

    // ============ 接收者 ============

    @Nested
    @DisplayName("接收者")
    class Receivers {

        private IrClass box;
        private IrSimpleFunction get;
        private IrConst boxValue;

        @BeforeEach
        void declare() {
            box = fx.userClass("Box");
            get = fx.member(box, "get", fx.builtIns.intType());
            fx.parameter(get, "i", fx.builtIns.intType());
            boxValue = new IrConst(50, 53, box.getDefaultType(), "b");
        }

        @Test
        @DisplayName("绑定分派接收者：生成两语句块，接收者作为适配函数的扩展接收者")
        void boundDispatch() {
            CallableReferenceAccess reference = LoweringFixture.reference("get")
                    .explicitReceiver(ExplicitReceiverKind.EXPRESSION)
                    .dispatchReceiver(true)
                    .build();
            IrSimpleType type = fx.functionType(fx.builtIns.unitType(), fx.builtIns.intType());

            IrExpression result = synthesizer.synthesizeForCallableReference(reference, boxValue,
                    get.getSymbol(), type);

            assertThat(result).isInstanceOf(IrBlock.class);
            IrBlock block = (IrBlock) result;
            assertThat(block.getOrigin()).isEqualTo(IrStatementOrigin.ADAPTED_FUNCTION_REFERENCE);
            assertThat(block.getStatements()).hasSize(2);

            IrSimpleFunction adapter = adapterOf(result);
            assertThat(adapter.getExtensionReceiverParameter().getName()).isEqualTo("receiver");
            assertThat(adapter.getExtensionReceiverParameter().getType()).isEqualTo(box.getDefaultType());

            IrFunctionReference adapterReference = (IrFunctionReference) block.getStatements().get(1);
            assertThat(adapterReference.getSymbol()).isSameAs(adapter.getSymbol());
            assertThat(adapterReference.getExtensionReceiver()).isSameAs(boxValue);
            assertThat(adapterReference.getType()).isEqualTo(type);

            IrMemberAccessExpression<?> call = adapteeCall(result);
            assertThat(call.getDispatchReceiver()).isInstanceOf(IrGetValue.class);
            assertThat(((IrGetValue) call.getDispatchReceiver()).getOrigin())
                    .isEqualTo(IrStatementOrigin.ADAPTED_FUNCTION_REFERENCE);
            assertThat(IrRenderer.render(result))
                    .isEqualTo("{ local fun Box.get(p0: Int): Unit { receiver.get(p0) }; \"b\"::get }");
        }

        @Test
        @DisplayName("绑定扩展接收者")
        void boundExtension() {
            IrSimpleFunction ext = fx.extension(fx.builtIns.stringType(), "ext", fx.builtIns.intType());
            fx.parameter(ext, "i", fx.builtIns.intType());
            CallableReferenceAccess reference = LoweringFixture.reference("ext")
                    .explicitReceiver(ExplicitReceiverKind.EXPRESSION)
                    .extensionReceiver(true)
                    .build();
            IrConst text = new IrConst(50, 55, fx.builtIns.stringType(), "abc");
            IrSimpleType type = fx.functionType(fx.builtIns.unitType(), fx.builtIns.intType());

            IrExpression result = synthesizer.synthesizeForCallableReference(reference, text, ext.getSymbol(), type);

            IrMemberAccessExpression<?> call = adapteeCall(result);
            assertThat(call.getExtensionReceiver()).isInstanceOf(IrGetValue.class);
            assertThat(call.getDispatchReceiver()).isNull();
            assertThat(renderCall(result)).isEqualTo("receiver.ext(p0)");
        }

        @Test
        @DisplayName("同时绑定两个接收者报内部错误")
        void bothBound() {
            CallableReferenceAccess reference = LoweringFixture.reference("get")
                    .explicitReceiver(ExplicitReceiverKind.EXPRESSION)
                    .dispatchReceiver(true)
                    .extensionReceiver(true)
                    .build();
            IrSimpleType type = fx.functionType(fx.builtIns.unitType(), fx.builtIns.intType());

            assertThatThrownBy(() -> synthesizer.synthesizeForCallableReference(reference, boxValue,
                    get.getSymbol(), type))
                    .isInstanceOf(IrInternalError.class)
                    .hasMessageContaining("can't have both receivers");
            assertThat(fx.symbolTable.getDeclaredFunctionCount()).isZero();
        }

        @Test
        @DisplayName("A::foo 的成员函数：第一个适配参数作为分派接收者")
        void qualifierDispatch() {
            CallableReferenceAccess reference = LoweringFixture.reference("get")
                    .explicitReceiver(ExplicitReceiverKind.RESOLVED_QUALIFIER)
                    .dispatchReceiver(true)
                    .build();
            IrSimpleType type = fx.functionType(fx.builtIns.unitType(), box.getDefaultType(), fx.builtIns.intType());

            IrExpression result = synthesizer.synthesizeForCallableReference(reference, null, get.getSymbol(), type);

            assertThat(result).isInstanceOf(IrFunctionExpression.class);
            assertThat(renderCall(result)).isEqualTo("p0.get(p1)");
            assertThat(adapteeCall(result).getDispatchReceiver()).isNotNull();
        }

        @Test
        @DisplayName("A::foo 的扩展函数：第一个适配参数作为扩展接收者")
        void qualifierExtension() {
            IrSimpleFunction ext = fx.extension(fx.builtIns.stringType(), "ext", fx.builtIns.intType());
            fx.parameter(ext, "i", fx.builtIns.intType());
            CallableReferenceAccess reference = LoweringFixture.reference("ext")
                    .explicitReceiver(ExplicitReceiverKind.RESOLVED_QUALIFIER)
                    .extensionReceiver(true)
                    .build();
            IrSimpleType type = fx.functionType(fx.builtIns.unitType(),
                    fx.builtIns.stringType(), fx.builtIns.intType());

            IrExpression result = synthesizer.synthesizeForCallableReference(reference, null, ext.getSymbol(), type);

            assertThat(renderCall(result)).isEqualTo("p0.ext(p1)");
            assertThat(adapteeCall(result).getExtensionReceiver()).isNotNull();
            assertThat(adapteeCall(result).getDispatchReceiver()).isNull();
        }

        @Test
        @DisplayName("A::foo 没有适配参数承载接收者时报内部错误")
        void qualifierWithoutParameters() {
            CallableReferenceAccess reference = LoweringFixture.reference("get")
                    .explicitReceiver(ExplicitReceiverKind.RESOLVED_QUALIFIER)
                    .dispatchReceiver(true)
                    .build();
            IrSimpleType type = fx.functionType(fx.builtIns.unitType());

            assertThatThrownBy(() -> synthesizer.synthesizeForCallableReference(reference, null,
                    get.getSymbol(), type))
                    .isInstanceOf(IrInternalError.class)
                    .hasMessageContaining("no parameter for its receiver");
        }
    }

    // ============ 构造器与异常 ============

    @Nested
    @DisplayName("构造器与内部错误")
    class ConstructorsAndErrors {

        @Test
        @DisplayName("构造器引用生成构造器调用，类型实参填入类的类型参数槽位")
        void constructorCall() {
            IrClass box = fx.userClass("Box");
            IrTypeParameter t = fx.typeParameter(box, "T");
            IrConstructor constructor = fx.constructor(box);
            fx.parameter(constructor, "value", t.getDefaultType());
            CallableReferenceAccess reference = LoweringFixture.reference("Box")
                    .typeArguments(Collections.singletonList(LumenTypes.INT))
                    .build();
            IrSimpleType type = fx.functionType(fx.builtIns.anyType(), fx.builtIns.intType());

            IrExpression result = synthesizer.synthesizeForCallableReference(reference, null,
                    constructor.getSymbol(), type);

            IrMemberAccessExpression<?> call = adapteeCall(result);
            assertThat(call).isInstanceOf(IrConstructorCall.class);
            assertThat(IrRenderer.render(call)).isEqualTo("Box<Int>(p0)");
            assertThat(adapterOf(result).getName()).isEqualTo("<init>");
        }

        @Test
        @DisplayName("多余的类型实参被忽略")
        void extraTypeArgumentsIgnored() {
            IrClass plain = fx.userClass("Plain");
            IrConstructor constructor = fx.constructor(plain);
            CallableReferenceAccess reference = LoweringFixture.reference("Plain")
                    .typeArguments(Collections.singletonList(LumenTypes.INT))
                    .build();
            IrSimpleType type = fx.functionType(fx.builtIns.anyType());

            IrExpression result = synthesizer.synthesizeForCallableReference(reference, null,
                    constructor.getSymbol(), type);

            assertThat(renderCall(result)).isEqualTo("Plain()");
        }

        @Test
        @DisplayName("未知的被调用者种类报内部错误")
        void unknownCalleeKind() {
            IrSimpleFunction f = fx.function("f", fx.builtIns.intType());
            IrFunctionSymbol<IrSimpleFunction> foreignSymbol = new IrFunctionSymbol<IrSimpleFunction>() {};
            foreignSymbol.bind(f);
            IrSimpleType type = fx.functionType(fx.builtIns.unitType());

            assertThatThrownBy(() -> synthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("f").build(), null, foreignSymbol, type))
                    .isInstanceOf(IrInternalError.class)
                    .hasMessageContaining("Unknown callee kind");
        }

        @Test
        @DisplayName("没有声明父节点时报内部错误，作用域栈保持平衡")
        void noConversionParent() {
            LoweringFixture orphan = new LoweringFixture(false);
            AdapterSynthesizer orphanSynthesizer = new AdapterSynthesizer(orphan.context);
            IrSimpleFunction f = orphan.function("f", orphan.builtIns.intType());
            IrSimpleType type = orphan.functionType(orphan.builtIns.unitType());

            assertThatThrownBy(() -> orphanSynthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("f").build(), null, f.getSymbol(), type))
                    .isInstanceOf(IrInternalError.class)
                    .hasMessageContaining("No declaration parent");
            assertThat(orphan.symbolTable.getScopeDepth()).isZero();
        }

        @Test
        @DisplayName("适配参数在适配函数的作用域内声明")
        void parametersDeclaredInsideScope() {
            final List<Integer> depths = new ArrayList<>();
            final LoweringFixture[] holder = new LoweringFixture[1];
            IrFactoryImpl recording = new IrFactoryImpl() {
                @Override
                public IrValueParameter createValueParameter(int startOffset, int endOffset,
                                                             IrDeclarationOrigin origin,
                                                             IrValueParameterSymbol symbol, String name, int index,
                                                             IrType type, IrType varargElementType,
                                                             IrExpression defaultValue) {
                    depths.add(holder[0].symbolTable.getScopeDepth());
                    return super.createValueParameter(startOffset, endOffset, origin, symbol, name, index,
                            type, varargElementType, defaultValue);
                }
            };
            holder[0] = new LoweringFixture(true, recording);
            AdapterSynthesizer recordingSynthesizer = new AdapterSynthesizer(holder[0].context);
            IrSimpleFunction f = holder[0].function("f", holder[0].builtIns.intType());
            holder[0].parameter(f, "a", holder[0].builtIns.intType());
            IrSimpleType type = holder[0].functionType(holder[0].builtIns.unitType(), holder[0].builtIns.intType());

            recordingSynthesizer.synthesizeForCallableReference(
                    LoweringFixture.reference("f").build(), null, f.getSymbol(), type);

            assertThat(depths).containsExactly(1);
            assertThat(holder[0].symbolTable.getScopeDepth()).isZero();
            assertThat(holder[0].symbolTable.getDeclaredFunctionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("开启 dump 时输出适配结果的 JSON")
        void dumpsAdapter() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            fx.settings.setDumpAdapters(true);
            fx.settings.setDumpStream(new PrintStream(out, true));
            IrSimpleFunction f = fx.function("f", fx.builtIns.intType());
            IrSimpleType type = fx.functionType(fx.builtIns.unitType());

            synthesizer.synthesizeForCallableReference(LoweringFixture.reference("f").build(), null,
                    f.getSymbol(), type);

            String dumped = new String(out.toByteArray(), StandardCharsets.UTF_8);
            assertThat(dumped).contains("\"kind\": \"functionExpression\"");
            assertThat(dumped).contains("ADAPTER_FOR_CALLABLE_REFERENCE");
        }
    }
}
