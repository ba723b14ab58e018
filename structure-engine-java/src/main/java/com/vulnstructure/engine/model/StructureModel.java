package com.vulnstructure.engine.model;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result records of the three analysis layers.
 * Field names use @SerializedName for JSON snake_case mapping. Every field is
 * present on failed results too (zero counts, empty collections), so consumers
 * can read any record without checking which layer produced it.
 */
public final class StructureModel {

    private StructureModel() {}

    // ---------------------------------------------------------------- pattern layer

    public static class PatternSummary {
        @SerializedName("success")            public boolean success;
        @SerializedName("error")              public String error;
        @SerializedName("node_count")         public int nodeCount;
        @SerializedName("depth")              public int depth;
        @SerializedName("syntax_error_count") public int syntaxErrorCount;
        @SerializedName("functions")          public List<FunctionPattern> functions = new ArrayList<>();
        @SerializedName("calls")              public List<CallPattern> calls = new ArrayList<>();
        @SerializedName("variables")          public List<VariablePattern> variables = new ArrayList<>();
        @SerializedName("pointers")           public List<PointerOperation> pointers = new ArrayList<>();
        @SerializedName("arrays")             public List<ArrayOperation> arrays = new ArrayList<>();
        @SerializedName("conditions")         public List<ControlStructure> conditions = new ArrayList<>();
        @SerializedName("loops")              public List<ControlStructure> loops = new ArrayList<>();

        public static PatternSummary failure(String error) {
            PatternSummary summary = new PatternSummary();
            summary.success = false;
            summary.error = error;
            return summary;
        }
    }

    public static class FunctionPattern {
        @SerializedName("name")        public String name;
        @SerializedName("return_type") public String returnType;
        @SerializedName("params")      public List<String> params = new ArrayList<>();
        @SerializedName("line")        public int line;
    }

    public static class CallPattern {
        @SerializedName("function_name") public String functionName;
        @SerializedName("args")          public List<String> args = new ArrayList<>();
        @SerializedName("line")          public int line;
    }

    public static class VariablePattern {
        @SerializedName("name")       public String name;
        @SerializedName("type")       public String type;
        @SerializedName("is_pointer") public boolean isPointer;
        @SerializedName("is_array")   public boolean isArray;
        @SerializedName("line")       public int line;
    }

    public static class PointerOperation {
        @SerializedName("operation") public String operation;
        @SerializedName("type")      public String type;     // pointer_expression or field_expression
        @SerializedName("line")      public int line;
    }

    public static class ArrayOperation {
        @SerializedName("operation") public String operation;
        @SerializedName("line")      public int line;
    }

    public static class ControlStructure {
        @SerializedName("type") public String type;
        @SerializedName("line") public int line;
    }

    // ----------------------------------------------------------- control-flow layer

    public static class ControlFlowReport {
        @SerializedName("success")      public boolean success;
        @SerializedName("error")        public String error;
        @SerializedName("functions")    public Map<String, FunctionControlFlow> functions = new LinkedHashMap<>();
        @SerializedName("global_stats") public ControlFlowStats globalStats = new ControlFlowStats();

        public static ControlFlowReport failure(String error) {
            ControlFlowReport report = new ControlFlowReport();
            report.success = false;
            report.error = error;
            return report;
        }
    }

    public static class ControlFlowStats {
        @SerializedName("total_functions") public int totalFunctions;
        @SerializedName("total_nodes")     public int totalNodes;
        @SerializedName("total_edges")     public int totalEdges;
    }

    public static class FunctionControlFlow {
        @SerializedName("success")           public boolean success;
        @SerializedName("error")             public String error;
        @SerializedName("node_count")        public int nodeCount;
        @SerializedName("edge_count")        public int edgeCount;
        @SerializedName("complexity")        public int complexity = 1;
        @SerializedName("complexity_rating") public String complexityRating = "low";
        @SerializedName("cycles")            public List<List<String>> cycles = new ArrayList<>();
        @SerializedName("exit_nodes")        public List<String> exitNodes = new ArrayList<>();
        @SerializedName("basic_blocks")      public int basicBlocks;
        @SerializedName("blocks")            public List<BasicBlockView> blocks = new ArrayList<>();
        @SerializedName("edges")             public List<FlowEdge> edges = new ArrayList<>();

        public static FunctionControlFlow failure(String error) {
            FunctionControlFlow cfg = new FunctionControlFlow();
            cfg.success = false;
            cfg.error = error;
            return cfg;
        }
    }

    public static class BasicBlockView {
        @SerializedName("id")              public String id;
        @SerializedName("start_line")      public int startLine;
        @SerializedName("end_line")        public int endLine;
        @SerializedName("statement_count") public int statementCount;
        @SerializedName("statements")      public List<BlockStatement> statements = new ArrayList<>();
    }

    public static class BlockStatement {
        @SerializedName("line") public int line;
        @SerializedName("text") public String text;
        @SerializedName("type") public String type;
    }

    public static class FlowEdge {
        @SerializedName("source") public String source;
        @SerializedName("target") public String target;
    }

    // ------------------------------------------------------------- dependency layer

    public static class DependenceReport {
        @SerializedName("success")      public boolean success;
        @SerializedName("error")        public String error;
        @SerializedName("functions")    public Map<String, FunctionDependence> functions = new LinkedHashMap<>();
        @SerializedName("global_stats") public DependenceStats globalStats = new DependenceStats();

        public static DependenceReport failure(String error) {
            DependenceReport report = new DependenceReport();
            report.success = false;
            report.error = error;
            return report;
        }
    }

    public static class DependenceStats {
        @SerializedName("total_functions")    public int totalFunctions;
        @SerializedName("total_variables")    public int totalVariables;
        @SerializedName("total_dependencies") public int totalDependencies;
    }

    public static class FunctionDependence {
        @SerializedName("success")                  public boolean success;
        @SerializedName("error")                    public String error;
        @SerializedName("variables")                public Map<String, VariableRecord> variables = new LinkedHashMap<>();
        @SerializedName("statements")               public List<StatementRecord> statements = new ArrayList<>();
        @SerializedName("dependencies")             public List<DependencyEdge> dependencies = new ArrayList<>();
        @SerializedName("patterns")                 public PatternBuckets patterns = new PatternBuckets();
        @SerializedName("variable_count")           public int variableCount;
        @SerializedName("dependency_count")         public int dependencyCount;
        @SerializedName("statement_count")          public int statementCount;
        @SerializedName("vulnerability_indicators") public IndicatorCounts vulnerabilityIndicators = new IndicatorCounts();

        public static FunctionDependence failure(String error) {
            FunctionDependence pdg = new FunctionDependence();
            pdg.success = false;
            pdg.error = error;
            return pdg;
        }
    }

    public static class VariableRecord {
        @SerializedName("type")             public String type;
        @SerializedName("declaration_line") public int declarationLine;
        @SerializedName("is_parameter")     public boolean isParameter;
        @SerializedName("is_pointer")       public boolean isPointer;
        @SerializedName("is_array")         public boolean isArray;
        @SerializedName("scope")            public String scope = "function";
    }

    public static class StatementRecord {
        @SerializedName("id")                public int id;
        @SerializedName("line")              public int line;
        @SerializedName("text")              public String text;
        @SerializedName("type")              public String type;
        @SerializedName("variables_used")    public List<String> variablesUsed = new ArrayList<>();
        @SerializedName("variables_defined") public List<String> variablesDefined = new ArrayList<>();
        @SerializedName("function_calls")    public List<String> functionCalls = new ArrayList<>();
        @SerializedName("is_assignment")     public boolean isAssignment;
        @SerializedName("is_function_call")  public boolean isFunctionCall;
        @SerializedName("is_control_flow")   public boolean isControlFlow;
    }

    public static class DependencyEdge {
        @SerializedName("source")      public int source;
        @SerializedName("target")      public int target;
        @SerializedName("variable")    public String variable;
        @SerializedName("type")        public String type = "data_dependency";
        @SerializedName("source_line") public int sourceLine;
        @SerializedName("target_line") public int targetLine;
    }

    public static class PatternBuckets {
        @SerializedName("buffer_operations")  public List<PatternMatch> bufferOperations = new ArrayList<>();
        @SerializedName("pointer_operations") public List<PatternMatch> pointerOperations = new ArrayList<>();
        @SerializedName("memory_operations")  public List<PatternMatch> memoryOperations = new ArrayList<>();
        @SerializedName("function_calls")     public List<TrackedCall> functionCalls = new ArrayList<>();
    }

    public static class PatternMatch {
        @SerializedName("line")      public int line;
        @SerializedName("statement") public String statement;
        @SerializedName("type")      public String type;
    }

    public static class TrackedCall {
        @SerializedName("line")      public int line;
        @SerializedName("function")  public String function;
        @SerializedName("statement") public String statement;
    }

    public static class IndicatorCounts {
        @SerializedName("buffer_ops")    public int bufferOps;
        @SerializedName("pointer_ops")   public int pointerOps;
        @SerializedName("memory_ops")    public int memoryOps;
        @SerializedName("tracked_funcs") public int trackedFuncs;
    }

    // ------------------------------------------------------------- combined result

    public static class StructuralAnalysis {
        @SerializedName("ast_patterns")       public PatternSummary astPatterns;
        @SerializedName("cfg_analysis")       public ControlFlowReport cfgAnalysis;
        @SerializedName("pdg_analysis")       public DependenceReport pdgAnalysis;
        @SerializedName("extraction_success") public ExtractionSuccess extractionSuccess;
    }

    public static class ExtractionSuccess {
        @SerializedName("ast") public boolean ast;
        @SerializedName("cfg") public boolean cfg;
        @SerializedName("pdg") public boolean pdg;
    }
}
