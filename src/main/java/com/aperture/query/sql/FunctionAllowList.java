package com.aperture.query.sql;

import com.aperture.query.QueryCompilerProperties;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Functions user queries may call. Matching is case-insensitive.
 */
public class FunctionAllowList {

    private static final Set<String> DEFAULT_FUNCTIONS = Set.copyOf(Arrays.asList(
        // aggregates
        "count", "countif", "countdistinct", "uniq", "uniqexact", "sum", "sumif", "avg", "avgif",
        "min", "minif", "max", "maxif", "any", "anylast", "argmin", "argmax", "quantile", "quantiles",
        "quantileexact", "quantiletdigest", "median", "stddevpop", "stddevsamp", "varpop", "varsamp",
        "grouparray", "groupuniqarray", "topk",
        // window
        "row_number", "rank", "dense_rank", "lag", "lead", "first_value", "last_value",
        "laginframe", "leadinframe",
        // conditional and null handling
        "if", "multiif", "ifnull", "nullif", "coalesce", "isnull", "isnotnull", "assumenotnull",
        "greatest", "least",
        // arithmetic
        "abs", "round", "floor", "ceil", "ceiling", "trunc", "sqrt", "pow", "power", "exp", "log",
        "ln", "log2", "log10", "intdiv", "modulo", "plus", "minus", "multiply", "divide", "negate",
        // strings
        "length", "lower", "upper", "trim", "trimleft", "trimright", "concat", "substring", "substr",
        "left", "right", "replace", "replaceall", "replaceone", "position", "positioncaseinsensitive",
        "startswith", "endswith", "like", "ilike", "notlike", "match", "splitbychar", "lowerutf8",
        "upperutf8", "tostring", "leftpad", "rightpad",
        // arrays and maps
        "has", "hasany", "hasall", "arrayjoin", "arraystringconcat", "empty", "notempty",
        "arraycount", "arrayelement", "indexof", "mapkeys", "mapvalues", "mapfromarrays", "tuple",
        // JSON
        "jsonextract", "jsonextractstring", "jsonextractint", "jsonextractuint", "jsonextractfloat",
        "jsonextractbool", "jsonextractraw", "jsonextractkeys", "jsonhas", "jsonlength", "jsontype",
        "simplejsonextractstring", "simplejsonextractraw", "simplejsonhas",
        // dates and times
        "now", "now64", "today", "yesterday", "todate", "todatetime", "todatetime64",
        "tostartofinterval", "tostartofminute", "tostartoffiveminutes", "tostartoffifteenminutes",
        "tostartofhour", "tostartofday", "tostartofweek", "tostartofmonth", "tostartofyear",
        "toyear", "tomonth", "todayofmonth", "todayofweek", "tohour", "tominute", "tosecond",
        "tounixtimestamp", "tounixtimestamp64milli", "tounixtimestamp64micro", "tounixtimestamp64nano",
        "datediff", "date_diff", "dateadd", "date_add", "datesub", "date_sub", "date_trunc", "datetrunc",
        "addseconds", "addminutes", "addhours", "adddays", "subtractseconds", "subtractminutes",
        "subtracthours", "subtractdays", "formatdatetime", "parsedatetimebesteffort",
        "tointervalsecond", "tointervalminute", "tointervalhour", "tointervalday",
        // conversions
        "touint8", "touint32", "touint64", "toint32", "toint64", "tofloat64", "touuid", "todecimal64",
        "cast"
    ));

    private final Set<String> allowed;

    public FunctionAllowList(Collection<String> extraFunctions) {
        Set<String> functions = new HashSet<>(DEFAULT_FUNCTIONS);
        for (String function : extraFunctions) {
            functions.add(function.toLowerCase(Locale.ROOT));
        }
        this.allowed = Collections.unmodifiableSet(functions);
    }

    public static FunctionAllowList defaults() {
        return new FunctionAllowList(Collections.emptySet());
    }

    public static FunctionAllowList from(QueryCompilerProperties properties) {
        return new FunctionAllowList(properties.getExtraAllowedFunctions());
    }

    public boolean isAllowed(String functionName) {
        return functionName != null && allowed.contains(SqlIdentifiers.normalize(functionName));
    }
}
