package com.mathide.core.history;

/**
 * One arm of a system, case split or set of alternatives, attached to a step as a
 * read-only annotation. Branches are not separate chains and cannot be continued.
 */
public final class Branch {

    private final String  id;
    private final String  name;
    private final String  expression;
    private final String  condition;
    private final boolean valid;

    public Branch(String id, String name, String expression, String condition, boolean valid) {
        this.id         = id;
        this.name       = name != null ? name : "";
        this.expression = expression != null ? expression : "";
        this.condition  = condition;
        this.valid      = valid;
    }

    public String  getId()         { return id; }
    public String  getName()       { return name; }
    public String  getExpression() { return expression; }
    public String  getCondition()  { return condition; }
    public boolean isValid()       { return valid; }

    @Override
    public String toString() {
        return "Branch{" + id + ", " + name + ": " + expression
                + (condition != null ? " if " + condition : "") + (valid ? "" : ", invalid") + "}";
    }
}
