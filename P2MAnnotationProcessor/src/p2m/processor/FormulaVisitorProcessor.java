package p2m.processor;

import java.io.IOException;
import java.util.Set;
import java.util.TreeSet;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.ElementFilter;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing of the formula tree.
 *
 * <p>For every {@link FormulaNode} class {@code Outer.Node} it writes an interface
 * {@code Outer_Node_FormulaNode} whose default {@code accept} dispatches to the visitor and whose
 * default {@code visitChildren} walks the {@link FormulaChild} accessors in declaration order. Once
 * the nodes are known it also writes {@code FormulaVisitor}, {@code DefaultFormulaVisitor} and
 * {@code VoidDefaultFormulaVisitor}, each with one method per node.
 */
@AutoService(Processor.class)
public class FormulaVisitorProcessor extends AbstractProcessor {

  private static final String PACKAGE = "p2m";

  private static final ClassName NODE_INTERFACE = ClassName.get(PACKAGE, "FormulaNodeInterface");
  private static final ClassName NODE_UTILS = ClassName.get(PACKAGE, "FormulaNodeUtils");
  private static final ClassName VISITOR = ClassName.get(PACKAGE, "FormulaVisitor");
  private static final ClassName DEFAULT_VISITOR = ClassName.get(PACKAGE, "DefaultFormulaVisitor");
  private static final ClassName VOID_VISITOR = ClassName.get(PACKAGE, "VoidDefaultFormulaVisitor");
  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final TypeName VOID = ClassName.get(Void.class);

  private final Set<ClassName> nodes = new TreeSet<>();
  private boolean visitorsWritten = false;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(FormulaNode.class.getName(), FormulaChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    for (TypeElement element :
        ElementFilter.typesIn(roundEnv.getElementsAnnotatedWith(FormulaNode.class))) {
      ClassName node = ClassName.get(element);
      nodes.add(node);
      try {
        writeNodeInterface(element, node);
      } catch (IOException ex) {
        error("Cannot write " + interfaceName(node) + ": " + ex, element);
      }
    }

    // Every node is hand-written, so all of them are seen in the first round that has any.
    if (!visitorsWritten && !nodes.isEmpty()) {
      visitorsWritten = true;
      try {
        write(visitorInterface());
        write(defaultVisitor());
        write(voidDefaultVisitor());
      } catch (IOException ex) {
        error("Cannot write visitors: " + ex, null);
      }
    }
    return true;
  }

  private void error(String message, Element element) {
    processingEnv.getMessager().printMessage(Kind.ERROR, message, element);
  }

  private void write(TypeSpec type) throws IOException {
    JavaFile.builder(PACKAGE, type).build().writeTo(processingEnv.getFiler());
  }

  // Expression.Atom -> Expression_Atom_FormulaNode
  private static String interfaceName(ClassName node) {
    return String.join("_", node.simpleNames()) + "_FormulaNode";
  }

  private static ParameterizedTypeName visitorOf(TypeName value) {
    return ParameterizedTypeName.get(VISITOR, value);
  }

  private void writeNodeInterface(TypeElement element, ClassName node) throws IOException {
    String interfaceName = interfaceName(node);
    // Not generated yet, so the supertype may still be an error type; compare by name.
    if (element.getInterfaces().stream().noneMatch(i -> i.toString().endsWith(interfaceName))) {
      error(String.format("%s must implement %s", node.simpleName(), interfaceName), element);
      return;
    }

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorOf(V), "visitor")
            .addParameter(V, "value");
    TypeSpec.Builder type =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(NODE_INTERFACE);

    for (ExecutableElement child : ElementFilter.methodsIn(element.getEnclosedElements())) {
      if (child.getAnnotation(FormulaChild.class) == null) continue;
      if (child.getAnnotation(Override.class) == null) {
        error("@FormulaChild accessors must be @Override", child);
      }

      String name = child.getSimpleName().toString();
      type.addMethod(
          MethodSpec.methodBuilder(name)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(child.getReturnType()))
              .build());
      visitChildren.addStatement("value = $T.accept($N(), visitor, value)", NODE_UTILS, name);
    }

    type.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorOf(V), "visitor")
            .addParameter(V, "value")
            .addStatement("return visitor.visit(($T) this, value)", node)
            .build());
    type.addMethod(visitChildren.addStatement("return value").build());

    JavaFile.builder(node.packageName(), type.addOriginatingElement(element).build())
        .build()
        .writeTo(processingEnv.getFiler());
  }

  private TypeSpec visitorInterface() {
    TypeSpec.Builder type =
        TypeSpec.interfaceBuilder(VISITOR).addModifiers(Modifier.PUBLIC).addTypeVariable(V);
    for (ClassName node : nodes) {
      type.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .build());
    }
    return type.build();
  }

  private TypeSpec defaultVisitor() {
    TypeSpec.Builder type =
        TypeSpec.classBuilder(DEFAULT_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(visitorOf(V));
    for (ClassName node : nodes) {
      type.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
    }
    return type.build();
  }

  // Side-effecting visitors override visitImpl; visit itself is sealed.
  private TypeSpec voidDefaultVisitor() {
    TypeSpec.Builder type =
        TypeSpec.classBuilder(VOID_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(DEFAULT_VISITOR, VOID));
    for (ClassName node : nodes) {
      type.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(VOID)
              .addParameter(node, "node")
              .addParameter(VOID, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      type.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(node, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }
    return type.build();
  }
}
