package com.lumenlang.ir.lowering;

import com.lumenlang.compiler.analysis.types.SuperTypeRegistry;
import com.lumenlang.ir.IrBuiltIns;
import com.lumenlang.ir.util.DeclarationStorage;
import com.lumenlang.ir.util.IrFactory;
import com.lumenlang.ir.util.IrFactoryImpl;
import com.lumenlang.ir.util.SymbolTable;

import java.util.Objects;

/**
 * Lowering 协作者集合。
 * 一个编译单元共享一个上下文；字段在构造后不再替换。
 */
public class LoweringContext {

    private final IrBuiltIns builtIns;
    private final DeclarationStorage declarationStorage;
    private final SuperTypeRegistry superTypeRegistry;
    private final TypeConverter typeConverter;
    private final SymbolTable symbolTable;
    private final IrFactory irFactory;
    private final ReceiverResolver receiverResolver;
    private final InvokeMemberResolver invokeMemberResolver;
    private final ConversionScope conversionScope;
    private final LoweringSettings settings;

    private LoweringContext(Builder builder) {
        this.builtIns = Objects.requireNonNull(builder.builtIns, "builtIns");
        this.declarationStorage = builder.declarationStorage != null
                ? builder.declarationStorage : new DeclarationStorage(builtIns);
        this.superTypeRegistry = builder.superTypeRegistry != null
                ? builder.superTypeRegistry : new SuperTypeRegistry();
        this.typeConverter = builder.typeConverter != null
                ? builder.typeConverter : new DefaultTypeConverter(declarationStorage);
        this.symbolTable = builder.symbolTable != null ? builder.symbolTable : new SymbolTable();
        this.irFactory = builder.irFactory != null ? builder.irFactory : IrFactoryImpl.INSTANCE;
        this.receiverResolver = builder.receiverResolver != null
                ? builder.receiverResolver : new ExplicitReceiverResolver();
        this.invokeMemberResolver = builder.invokeMemberResolver != null
                ? builder.invokeMemberResolver : new DefaultInvokeMemberResolver(declarationStorage, typeConverter);
        this.conversionScope = builder.conversionScope != null ? builder.conversionScope : new ConversionScope();
        this.settings = builder.settings != null ? builder.settings : LoweringSettings.fromEnvironment();
    }

    public static Builder builder(IrBuiltIns builtIns) {
        return new Builder(builtIns);
    }

    public IrBuiltIns getBuiltIns() { return builtIns; }
    public DeclarationStorage getDeclarationStorage() { return declarationStorage; }
    public SuperTypeRegistry getSuperTypeRegistry() { return superTypeRegistry; }
    public TypeConverter getTypeConverter() { return typeConverter; }
    public SymbolTable getSymbolTable() { return symbolTable; }
    public IrFactory getIrFactory() { return irFactory; }
    public ReceiverResolver getReceiverResolver() { return receiverResolver; }
    public InvokeMemberResolver getInvokeMemberResolver() { return invokeMemberResolver; }
    public ConversionScope getConversionScope() { return conversionScope; }
    public LoweringSettings getSettings() { return settings; }

    public static final class Builder {
        private final IrBuiltIns builtIns;
        private DeclarationStorage declarationStorage;
        private SuperTypeRegistry superTypeRegistry;
        private TypeConverter typeConverter;
        private SymbolTable symbolTable;
        private IrFactory irFactory;
        private ReceiverResolver receiverResolver;
        private InvokeMemberResolver invokeMemberResolver;
        private ConversionScope conversionScope;
        private LoweringSettings settings;

        private Builder(IrBuiltIns builtIns) {
            this.builtIns = builtIns;
        }

        public Builder declarationStorage(DeclarationStorage declarationStorage) {
            this.declarationStorage = declarationStorage;
            return this;
        }

        public Builder superTypeRegistry(SuperTypeRegistry superTypeRegistry) {
            this.superTypeRegistry = superTypeRegistry;
            return this;
        }

        public Builder typeConverter(TypeConverter typeConverter) {
            this.typeConverter = typeConverter;
            return this;
        }

        public Builder symbolTable(SymbolTable symbolTable) {
            this.symbolTable = symbolTable;
            return this;
        }

        public Builder irFactory(IrFactory irFactory) {
            this.irFactory = irFactory;
            return this;
        }

        public Builder receiverResolver(ReceiverResolver receiverResolver) {
            this.receiverResolver = receiverResolver;
            return this;
        }

        public Builder invokeMemberResolver(InvokeMemberResolver invokeMemberResolver) {
            this.invokeMemberResolver = invokeMemberResolver;
            return this;
        }

        public Builder conversionScope(ConversionScope conversionScope) {
            this.conversionScope = conversionScope;
            return this;
        }

        public Builder settings(LoweringSettings settings) {
            this.settings = settings;
            return this;
        }

        public LoweringContext build() {
            return new LoweringContext(this);
        }
    }
}
