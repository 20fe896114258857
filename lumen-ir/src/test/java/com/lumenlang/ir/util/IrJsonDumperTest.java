package com.lumenlang.ir.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lumenlang.ir.IrBuiltIns;
import com.lumenlang.ir.declarations.*;
import com.lumenlang.ir.expressions.*;
import com.lumenlang.ir.symbols.IrSimpleFunctionSymbol;
import com.lumenlang.ir.symbols.IrValueParameterSymbol;
import com.lumenlang.ir.types.IrTypePredicates.FunctionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IrJsonDumper JSON 输出")
class IrJsonDumperTest {

    private final IrBuiltIns builtIns = new IrBuiltIns();
    private final IrJsonDumper dumper = new IrJsonDumper();

    private IrSimpleFunction adapter() {
        IrSimpleFunction target = new IrSimpleFunction(100, 200, IrDeclarationOrigin.DEFINED,
                new IrSimpleFunctionSymbol(), "target", IrVisibility.PUBLIC, IrModality.FINAL,
                builtIns.unitType(), null);
        IrSimpleFunction adapter = new IrSimpleFunction(10, 30, IrDeclarationOrigin.ADAPTER_FOR_CALLABLE_REFERENCE,
                new IrSimpleFunctionSymbol(), "target", IrVisibility.LOCAL, IrModality.FINAL,
                builtIns.unitType(), EnumSet.of(IrModifier.SUSPEND));
        IrValueParameter p0 = new IrValueParameter(10, 30,
                IrDeclarationOrigin.ADAPTER_PARAMETER_FOR_CALLABLE_REFERENCE, new IrValueParameterSymbol(),
                "p0", 0, builtIns.intType(), null, null);
        adapter.addValueParameter(p0);
        IrCall call = new IrCall(100, 200, builtIns.unitType(), target.getSymbol(), 0, 2);
        call.putValueArgument(0, IrGetValue.of(100, 200, p0));
        adapter.setBody(new IrBlockBody(10, 30, Collections.singletonList(call)));
        return adapter;
    }

    @Test
    @DisplayName("函数表达式包含 kind、位置、来源与嵌套函数")
    void functionExpression() {
        IrSimpleFunction adapter = adapter();
        IrFunctionExpression expression = new IrFunctionExpression(10, 30,
                builtIns.functionType(FunctionKind.SUSPEND_FUNCTION,
                        Collections.singletonList(builtIns.intType()), builtIns.unitType()),
                adapter, IrStatementOrigin.ADAPTED_FUNCTION_REFERENCE);

        JsonObject json = dumper.dump(expression).getAsJsonObject();

        assertThat(json.get("kind").getAsString()).isEqualTo("functionExpression");
        assertThat(json.get("startOffset").getAsInt()).isEqualTo(10);
        assertThat(json.get("origin").getAsString()).isEqualTo("ADAPTED_FUNCTION_REFERENCE");
        assertThat(json.get("type").getAsString()).isEqualTo("SuspendFunction1<Int, Unit>");

        JsonObject function = json.getAsJsonObject("function");
        assertThat(function.get("kind").getAsString()).isEqualTo("function");
        assertThat(function.get("origin").getAsString()).isEqualTo("ADAPTER_FOR_CALLABLE_REFERENCE");
        assertThat(function.getAsJsonArray("modifiers").get(0).getAsString()).isEqualTo("SUSPEND");
        assertThat(function.get("extensionReceiver").isJsonNull()).isTrue();

        JsonObject call = function.getAsJsonObject("body").getAsJsonArray("statements").get(0).getAsJsonObject();
        assertThat(call.get("kind").getAsString()).isEqualTo("call");
        JsonArray arguments = call.getAsJsonArray("valueArguments");
        assertThat(arguments.get(0).getAsJsonObject().get("name").getAsString()).isEqualTo("p0");
        assertThat(arguments.get(1).isJsonNull()).isTrue();
    }

    @Test
    @DisplayName("toJson 输出带缩进的文本，保留 null 字段")
    void prettyPrinted() {
        String text = dumper.toJson(adapter());

        assertThat(text).contains("\n  \"kind\": \"function\"");
        assertThat(text).contains("\"dispatchReceiver\": null");
    }

    @Test
    @DisplayName("null 元素输出 JSON null")
    void nullElement() {
        assertThat(dumper.dump(null).isJsonNull()).isTrue();
    }
}
