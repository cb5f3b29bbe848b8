package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code array.*} 列表函数
 */
public class ArrayFunctions extends ScriptFunctionLibrary {

    public ArrayFunctions() {
        super("array");
        register("cycle", 1, 2, ArrayFunctions::cycle);
        register("size", 1, 1, ArrayFunctions::size);
        register("first", 1, 1, args -> first(args.getList(0, "array.first")));
        register("last", 1, 1, args -> last(args.getList(0, "array.last")));
        register("join", 2, 2, args -> join(args.getContext(), args, args.getList(0, "array.join"), args.getString(1)));
        register("add", 2, 2, args -> add(args.getList(0, "array.add"), args.get(1)));
        register("reverse", 1, 1, args -> reverse(args.getList(0, "array.reverse")));
    }

    /**
     * 每次调用依次返回列表中的下一个元素，游标按 group (缺省为元素拼接) 保存在上下文中
     */
    static Object cycle(FunctionArguments args) {
        List<?> list = args.getList(0, "array.cycle");
        if (list == null) {
            return null;
        }
        TemplateContext context = args.getContext();
        Object group = args.get(1, "group", null);
        String groupName = group == null ? join(context, args, list, ",") : context.toString(args.getSpan(), group);

        Map<Object, Object> tags = context.getTags();
        CycleKey key = new CycleKey(groupName);
        Object current = tags.get(key);
        int index = current instanceof Integer ? (Integer) current : 0;
        index = list.isEmpty() ? 0 : index % list.size();
        Object result = null;
        if (!list.isEmpty()) {
            result = list.get(index);
            index++;
        }
        tags.put(key, index);
        return result;
    }

    static int size(FunctionArguments args) {
        Object value = args.get(0);
        if (value == null) {
            return 0;
        }
        if (value instanceof String) {
            return ((String) value).length();
        }
        return args.getList(0, "array.size").size();
    }

    static Object first(List<?> list) {
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    static Object last(List<?> list) {
        return list == null || list.isEmpty() ? null : list.get(list.size() - 1);
    }

    static String join(TemplateContext context, FunctionArguments args, List<?> list, String delimiter) {
        if (list == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        boolean afterFirst = false;
        for (Object item : list) {
            if (afterFirst && delimiter != null) {
                text.append(delimiter);
            }
            text.append(Objects.toString(context.toString(args.getSpan(), item), ""));
            afterFirst = true;
        }
        return text.toString();
    }

    /**
     * 返回追加元素后的新列表，原列表不变
     */
    static ScriptArray add(List<?> list, Object value) {
        ScriptArray result = list == null ? new ScriptArray() : new ScriptArray(list);
        result.add(value);
        return result;
    }

    static ScriptArray reverse(List<?> list) {
        ScriptArray result = new ScriptArray();
        if (list == null) {
            return result;
        }
        for (int i = list.size() - 1; i >= 0; i--) {
            result.add(list.get(i));
        }
        return result;
    }

    private static final class CycleKey {

        private final String group;

        private CycleKey(String group) {
            this.group = group;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof CycleKey && Objects.equals(group, ((CycleKey) o).group);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(group);
        }

        @Override
        public String toString() {
            return "cycle " + group;
        }
    }
}
