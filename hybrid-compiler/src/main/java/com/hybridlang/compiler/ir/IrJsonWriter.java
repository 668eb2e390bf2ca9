package com.hybridlang.compiler.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.Map;

/**
 * 把分析后的 IR 序列化为 JSON，用于调试转储。
 * 只输出结构，不输出函数体原文。
 */
public final class IrJsonWriter {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private IrJsonWriter() {}

    public static String write(IrModule module) {
        return GSON.toJson(toJson(module));
    }

    public static JsonObject toJson(IrModule module) {
        JsonObject root = new JsonObject();

        JsonArray classes = new JsonArray();
        for (ClassDecl c : module.getClasses()) {
            classes.add(classToJson(c));
        }
        root.add("classes", classes);

        JsonArray functions = new JsonArray();
        for (Function f : module.getFunctions()) {
            functions.add(functionToJson(f));
        }
        root.add("functions", functions);

        JsonArray globals = new JsonArray();
        for (Variable v : module.getGlobalVariables()) {
            globals.add(variableToJson(v));
        }
        root.add("globals", globals);

        JsonArray enums = new JsonArray();
        for (EnumDecl e : module.getEnums()) {
            JsonObject obj = new JsonObject();
            obj.addProperty("name", e.getName());
            obj.addProperty("scoped", e.isScoped());
            obj.add("enumerators", strings(e.getEnumerators()));
            enums.add(obj);
        }
        root.add("enums", enums);

        JsonObject registry = new JsonObject();
        for (Map.Entry<String, Type> e : module.getTypeRegistry().entrySet()) {
            registry.addProperty(e.getKey(), e.getValue().getKind().name());
        }
        root.add("types", registry);
        return root;
    }

    private static JsonObject classToJson(ClassDecl c) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", c.getName());
        obj.addProperty("struct", c.isStruct());
        obj.add("bases", strings(c.getBaseClasses()));
        if (c.isTemplate()) {
            obj.add("templateParameters", templateParams(c.getTemplateParameters()));
        }
        if (c.getSpecialization().isSpecialization()) {
            obj.add("specializedArgs", strings(c.getSpecialization().getSpecializedArgs()));
            obj.addProperty("partialSpecialization", c.getSpecialization().isPartial());
        }

        JsonArray sections = new JsonArray();
        for (AccessSection s : c.getAccessSections()) {
            JsonObject section = new JsonObject();
            section.addProperty("level", s.getLevel().name());
            section.add("members", strings(s.getMembers()));
            sections.add(section);
        }
        obj.add("accessSections", sections);

        JsonArray fields = new JsonArray();
        for (Variable v : c.getFields()) {
            fields.add(variableToJson(v));
        }
        obj.add("fields", fields);

        JsonArray methods = new JsonArray();
        for (Function f : c.getMethods()) {
            methods.add(functionToJson(f));
        }
        obj.add("methods", methods);

        JsonArray mutexes = new JsonArray();
        for (MutexInfo m : c.getMutexes()) {
            mutexes.add(m.getMutexVar() + ":" + m.getKind().name());
        }
        obj.add("mutexes", mutexes);
        JsonArray atomics = new JsonArray();
        for (AtomicInfo a : c.getAtomics()) {
            atomics.add(a.getVariable());
        }
        obj.add("atomics", atomics);
        return obj;
    }

    private static JsonObject functionToJson(Function f) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", f.getName());
        obj.addProperty("returnType", f.getReturnType() == null ? null : f.getReturnType().getName());

        JsonArray params = new JsonArray();
        for (Parameter p : f.getParameters()) {
            JsonObject param = new JsonObject();
            param.addProperty("name", p.getName());
            param.add("type", typeToJson(p.getType()));
            if (p.hasDefaultValue()) {
                param.addProperty("default", p.getDefaultValue());
            }
            params.add(param);
        }
        obj.add("parameters", params);

        JsonObject flags = new JsonObject();
        flags.addProperty("const", f.isConst());
        flags.addProperty("static", f.isStatic());
        flags.addProperty("virtual", f.isVirtual());
        flags.addProperty("pureVirtual", f.isPureVirtual());
        flags.addProperty("override", f.isOverride());
        flags.addProperty("constructor", f.isConstructor());
        flags.addProperty("destructor", f.isDestructor());
        flags.addProperty("hasBody", f.hasBody());
        obj.add("flags", flags);

        JsonObject exceptions = new JsonObject();
        exceptions.addProperty("mayThrow", f.mayThrow());
        exceptions.addProperty("noexcept", f.getExceptionSpec().isNoexcept());
        exceptions.add("throwTypes", strings(f.getExceptionSpec().getThrowTypes()));
        exceptions.addProperty("tryCatchBlocks", f.getTryCatchBlocks().size());
        obj.add("exceptions", exceptions);

        if (f.isTemplate()) {
            obj.add("templateParameters", templateParams(f.getTemplateParameters()));
        }

        JsonObject concurrency = new JsonObject();
        concurrency.addProperty("threads", f.getThreads().size());
        concurrency.addProperty("mutexes", f.getMutexes().size());
        concurrency.addProperty("locks", f.getLocks().size());
        concurrency.addProperty("atomics", f.getAtomics().size());
        concurrency.addProperty("conditionVariables", f.getConditionVariables().size());
        obj.add("concurrency", concurrency);

        JsonObject async = new JsonObject();
        async.addProperty("isAsync", f.isAsync());
        async.addProperty("isCoroutine", f.getCoroutineInfo().isCoroutine());
        async.addProperty("isGenerator", f.getCoroutineInfo().isGenerator());
        JsonArray ops = new JsonArray();
        for (AsyncOperation op : f.getCoroutineInfo().getOperations()) {
            JsonObject o = new JsonObject();
            o.addProperty("kind", op.getKind().getKeyword());
            o.addProperty("expression", op.getExpression());
            o.addProperty("line", op.getLine());
            ops.add(o);
        }
        async.add("operations", ops);
        JsonArray futures = new JsonArray();
        for (FutureInfo fi : f.getFutures()) {
            futures.add(fi.getFutureVar());
        }
        async.add("futures", futures);
        JsonArray tasks = new JsonArray();
        for (AsyncTaskInfo t : f.getAsyncTasks()) {
            tasks.add(t.getFunctionName());
        }
        async.add("asyncTasks", tasks);
        obj.add("async", async);

        JsonObject ownership = new JsonObject();
        ownership.add("moved", strings(f.getMovedParams()));
        ownership.add("borrowed", strings(f.getBorrowedParams()));
        obj.add("ownership", ownership);
        return obj;
    }

    private static JsonObject variableToJson(Variable v) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", v.getName());
        obj.add("type", typeToJson(v.getType()));
        obj.addProperty("static", v.isStatic());
        obj.addProperty("const", v.isConst());
        if (v.hasInitializer()) {
            obj.addProperty("initializer", v.getInitializer());
        }
        return obj;
    }

    private static JsonObject typeToJson(Type t) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", t.getKind().name());
        obj.addProperty("name", t.getName());
        if (t.isConst()) {
            obj.addProperty("const", true);
        }
        if (t.getKind() == TypeKind.POINTER) {
            obj.addProperty("ownership", t.getOwnership().name());
        }
        if (t.getElementType() != null) {
            obj.add("element", typeToJson(t.getElementType()));
        }
        if (!t.getTemplateArgs().isEmpty()) {
            JsonArray args = new JsonArray();
            for (Type arg : t.getTemplateArgs()) {
                args.add(typeToJson(arg));
            }
            obj.add("templateArgs", args);
        }
        return obj;
    }

    private static JsonArray templateParams(List<TemplateParameter> params) {
        JsonArray arr = new JsonArray();
        for (TemplateParameter p : params) {
            arr.add(p.toString());
        }
        return arr;
    }

    private static JsonArray strings(List<String> values) {
        JsonArray arr = new JsonArray();
        for (String v : values) {
            arr.add(v);
        }
        return arr;
    }
}
