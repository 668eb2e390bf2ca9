package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * try / catch 块，内容保存为原始文本
 */
public class TryCatchBlock {

    /**
     * 单个 catch 子句。exceptionType 为 "..." 表示捕获全部。
     */
    public static final class CatchClause {
        private final String exceptionType;
        private final String exceptionVar;
        private final String handlerBody;

        public CatchClause(String exceptionType, String exceptionVar, String handlerBody) {
            this.exceptionType = exceptionType;
            this.exceptionVar = exceptionVar != null ? exceptionVar : "";
            this.handlerBody = handlerBody;
        }

        public String getExceptionType() { return exceptionType; }
        public String getExceptionVar() { return exceptionVar; }
        public String getHandlerBody() { return handlerBody; }

        public boolean isCatchAll() {
            return "...".equals(exceptionType);
        }
    }

    private final String tryBody;
    private final List<CatchClause> catchClauses = new ArrayList<CatchClause>();

    public TryCatchBlock(String tryBody) {
        this.tryBody = tryBody;
    }

    public String getTryBody() {
        return tryBody;
    }

    public List<CatchClause> getCatchClauses() {
        return catchClauses;
    }

    public void addCatchClause(CatchClause clause) {
        catchClauses.add(clause);
    }

    public boolean hasCatchAll() {
        for (CatchClause clause : catchClauses) {
            if (clause.isCatchAll()) return true;
        }
        return false;
    }
}
