package com.initialone.typerename.rewrite;

import com.initialone.typerename.bind.Bindings;
import com.initialone.typerename.bind.DeclarationBinder;
import com.initialone.typerename.lex.LexException;
import com.initialone.typerename.lex.Lexer;
import com.initialone.typerename.lex.SignificantTokens;
import com.initialone.typerename.lex.Token;
import com.initialone.typerename.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 每个文件一条流水线：词法 -&gt; 绑定 -&gt; 改写（类型推断按需调用）。
 * 规则表只读共享，本类无状态，可以被多个线程同时使用。
 */
public final class RewriteEngine {
    private static final Logger log = LoggerFactory.getLogger(RewriteEngine.class);

    private final RuleTable rules;

    public RewriteEngine(RuleTable rules) {
        this.rules = rules;
    }

    public RewriteResult rewrite(String file, String source) throws LexException {
        List<Token> tokens = Lexer.tokenize(source);
        SignificantTokens st = new SignificantTokens(tokens);
        Bindings bindings = new DeclarationBinder(st).bind();
        RewriteResult result = new Rewriter(file, source, bindings, rules).run();
        log.debug("{}: tokens={} bindings={} renamed={} unresolved={} conflicts={}",
                file, tokens.size(), bindings.bindingCount(),
                result.renamedCount(), result.unresolvedCount(), result.conflictCount());
        return result;
    }
}
