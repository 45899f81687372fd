package amc.processor;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;
import javax.tools.JavaFileObject;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the per-node {@code _IrNode} interfaces and the visitor hierarchy for every class
 * annotated with {@link IrNode}.
 */
@AutoService(Processor.class)
public class IrVisitorProcessor extends AbstractProcessor {

  private static final String PACKAGE = "amc";

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(IrNode.class.getName(), IrChild.class.getName());
  }

  // Sorted so the generated visitors are stable between builds.
  private final Set<String> allIrNodes = new TreeSet<>();
  private boolean visitorsWritten = false;

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    if (annotations.isEmpty() || roundEnv.processingOver()) {
      return false;
    }

    try {
      processImpl(roundEnv);

      // Every annotated node is a root element of the first round, so the visitors can be
      // written as soon as that round is done.
      if (!visitorsWritten && !allIrNodes.isEmpty()) {
        generateIrVisitorFiles();
        visitorsWritten = true;
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  @FunctionalInterface
  private static interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(String name, String format, TypeRenderer typeRenderer) throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              allIrNodes.stream().map(typeRenderer::renderType).collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateIrVisitorFiles() throws IOException {
    writeFile(
        "IrVisitor",
        "package amc;\n\npublic interface IrVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeFile(
        "DefaultIrVisitor",
        "package amc;\n\n"
            + "public abstract class DefaultIrVisitor<V> implements IrVisitor<V> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return node.visitChildren(this, value);\n"
                    + "  }",
                typeName));
    writeFile(
        "VoidDefaultIrVisitor",
        "package amc;\n\n"
            + "public abstract class VoidDefaultIrVisitor extends DefaultIrVisitor<Void> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%s node) {\n"
                    + "    node.visitChildren(this, null);\n"
                    + "  }",
                typeName, typeName));
  }

  private static String getIrNodeClassName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("IrNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return elems.stream().collect(Collectors.joining("_"));
  }

  private static final ClassName IR_NODE_INTERFACE_NAME =
      ClassName.get(PACKAGE, "IrNodeInterface");
  private static final ClassName IR_VISITOR_NAME = ClassName.get(PACKAGE, "IrVisitor");
  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final ClassName IR_NODE_UTILS_NAME = ClassName.get(PACKAGE, "IrNodeUtils");

  private void writeIrNodeFile(TypeElement element) throws IOException {
    String interfaceName = getIrNodeClassName(element);
    if (element
        .getInterfaces()
        .stream()
        .noneMatch(i -> TypeName.get(i).toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(IR_NODE_INTERFACE_NAME);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(IR_VISITOR_NAME, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build())
            .addStatement(
                "return visitor.visit(($L) this, value)", element.getQualifiedName().toString())
            .build());

    MethodSpec.Builder visitChildrenMethodBuilder =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(IR_VISITOR_NAME, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build());
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(IrChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(method.getSimpleName().toString())
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());

      visitChildrenMethodBuilder.addStatement(
          "value = $T.accept($L(), visitor, value)",
          IR_NODE_UTILS_NAME,
          method.getSimpleName().toString());
    }
    typeSpecBuilder.addMethod(visitChildrenMethodBuilder.addStatement("return value").build());

    JavaFile javaFile = JavaFile.builder(PACKAGE, typeSpecBuilder.build()).build();
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + interfaceName);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private void processImpl(RoundEnvironment roundEnv) {
    for (Element element : roundEnv.getElementsAnnotatedWith(IrNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      try {
        writeIrNodeFile(typeElement);
      } catch (IOException ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }
      allIrNodes.add(typeElement.getQualifiedName().toString());
    }
  }
}
